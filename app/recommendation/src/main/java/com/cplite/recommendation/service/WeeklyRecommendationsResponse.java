package com.cplite.recommendation.service;

import com.cplite.recommendation.model.UserRecommendation;
import java.util.List;

record WeeklyRecommendationsResponse(List<UserRecommendation> recommendations) {}
