package io.tiller.core.dependency;

import java.io.Serial;

/// Invalid dependency declarations between the subcharts of a chart.
///
/// Raised before any resource is created.
public class DependencyGraphException extends InstallException {

    @Serial private static final long serialVersionUID = -5618224372014495002L;

    public DependencyGraphException(String chartName, String message) {
        super(chartName, message);
    }
}
