package com.ai.tpr.calculation;

public enum TprMethod {
    /** positive / tested * 100 */
    STANDARD,
    /** positive / outpatient attendance * 100 */
    ALTERNATIVE
}
