package com.questrail.hostlink.tool;

/**
 * Command-type identifiers understood by the host add-on.
 *
 * <p>Only the commands the link itself depends on, plus the read-only queries
 * most tools start from, are listed. Any other identifier the host supports
 * can be passed to {@link HostToolInvoker} as a plain string.</p>
 */
public final class HostCommands
{
    /** Cheapest status query; used as the connection health check. */
    public static final String GET_POLYHAVEN_STATUS = "get_polyhaven_status";

    public static final String GET_SCENE_INFO = "get_scene_info";
    public static final String GET_OBJECT_INFO = "get_object_info";
    public static final String GET_FULL_CONTEXT = "get_full_context";
    public static final String EXECUTE_CODE = "execute_code";

    private HostCommands() {}
}
