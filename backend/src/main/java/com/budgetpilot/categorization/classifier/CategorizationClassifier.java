package com.budgetpilot.categorization.classifier;

/**
 * External AI classification service. Called synchronously, one batch at a time per user.
 */
public interface CategorizationClassifier {

    /**
     * Groups the request's transactions under keyword rules with a category guess and lists the ones it skipped.
     *
     * @throws ClassifierException on rate limit, timeout, unavailability or an unusable response
     */
    ClassificationResult classify(ClassificationRequest request);
}
