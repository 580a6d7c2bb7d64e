/*
 * Where: shared web layer
 * What: registers RequestMdcInterceptor for every request
 * Why: services opt in with a single @Import
 */
package com.cplite.common.web;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class RequestMdcWebConfig implements WebMvcConfigurer {

  @Override
  public void addInterceptors(InterceptorRegistry registry) {
    registry.addInterceptor(new RequestMdcInterceptor());
  }
}
