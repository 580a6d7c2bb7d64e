package com.cplite.recommendation.service;

import com.cplite.recommendation.model.UserRecommendation;
import java.util.List;

/**
 * The weekly recommendation computation. Implementations may take a long time and signal failure
 * with an unchecked exception.
 */
public interface RecommendationComputation {

  List<UserRecommendation> compute();
}
