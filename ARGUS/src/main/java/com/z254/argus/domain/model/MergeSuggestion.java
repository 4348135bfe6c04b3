package com.z254.argus.domain.model;

import lombok.Value;

/**
 * Advisory pairing of two groups whose representatives look alike.
 */
@Value
public class MergeSuggestion {
    String groupIdA;
    String groupIdB;
    double similarity;
}
