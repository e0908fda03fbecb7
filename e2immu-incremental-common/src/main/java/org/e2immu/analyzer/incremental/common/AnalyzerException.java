package org.e2immu.analyzer.incremental.common;

/*
Wraps whatever went wrong while one analysis unit was being analyzed.
The unit is identified by its full name, so that the exception survives the unit itself.
 */
public class AnalyzerException extends RuntimeException {
    private final String unitName;

    public AnalyzerException(String unitName, Throwable throwable) {
        super("Exception analyzing " + unitName + ": " + throwable.getMessage(), throwable);
        this.unitName = unitName;
    }

    public String getUnitName() {
        return unitName;
    }
}
