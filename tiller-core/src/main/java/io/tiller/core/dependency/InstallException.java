package io.tiller.core.dependency;

import java.io.Serial;

/// Failure to install a chart.
///
/// Partially applied resources are left in place; rolling them back is the
/// responsibility of the enclosing action.
public class InstallException extends Exception {

    @Serial private static final long serialVersionUID = 3141786652913207451L;

    private final String chartName;

    public InstallException(String chartName, String message) {
        super(message);
        this.chartName = chartName;
    }

    public InstallException(String chartName, String message, Throwable cause) {
        super(message, cause);
        this.chartName = chartName;
    }

    /// @return name of the chart being installed when the failure occurred
    public String getChartName() {
        return chartName;
    }
}
