package io.healthcontroller.metrics;

/**
 * Constants for metrics names and tags used in the health controller.
 */
public class MetricsConstants {
    public final static String RECONCILE_TOTAL_METRIC_NAME = "reconcile_total";
    public final static String RECONCILE_DURATION_METRIC_NAME = "reconcile_duration";
    public final static String HEALTH_CHECK_EXPECTED_MACHINES_METRIC_NAME = "health_check_expected_machines";
    public final static String HEALTH_CHECK_CURRENT_HEALTHY_METRIC_NAME = "health_check_current_healthy";
    public final static String CLUSTER_NODE_WATCHES_METRIC_NAME = "cluster_node_watches";
    public final static String HEALTH_CHECK_EVENTS_METRIC_NAME = "health_check_events_total";
    public final static String NAMESPACE_TAG = "namespace";
    public final static String POLICY_TAG = "policy";
    public final static String RESULT_TAG = "result";
    public final static String REASON_TAG = "reason";
    public final static String RESULT_SUCCESS = "success";
    public final static String RESULT_REQUEUE = "requeue";
    public final static String RESULT_ERROR = "error";

    private MetricsConstants() {}
}
