package io.tiller.core.kube;

/// Pod list filter.
///
/// @param labelSelector label selector such as `job-name=migrate`, may be empty
/// @param fieldSelector field selector such as `metadata.name=probe`, may be empty
public record PodSelector(String labelSelector, String fieldSelector) {

    public PodSelector {
        labelSelector = labelSelector != null ? labelSelector : "";
        fieldSelector = fieldSelector != null ? fieldSelector : "";
    }

    public static PodSelector byLabel(String labelSelector) {
        return new PodSelector(labelSelector, "");
    }

    public static PodSelector byField(String fieldSelector) {
        return new PodSelector("", fieldSelector);
    }
}
