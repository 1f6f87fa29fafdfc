package net.lightapi.querylogs.tag;

import org.apache.commons.lang3.StringUtils;

import static net.lightapi.querylogs.QueryLogsConstants.ACTION;
import static net.lightapi.querylogs.QueryLogsConstants.APPLICATION;
import static net.lightapi.querylogs.QueryLogsConstants.CONTROLLER;
import static net.lightapi.querylogs.QueryLogsConstants.JOB;
import static net.lightapi.querylogs.QueryLogsConstants.NAMESPACED_CONTROLLER;
import static net.lightapi.querylogs.QueryLogsConstants.PID;

/**
 * Built-in tags available to every service. The request handler puts the controller and the
 * action into the execution context, the job runner puts the job.
 */
public class DefaultTaggings {

    private DefaultTaggings() {
    }

    /**
     * Registers application, pid, controller, action, namespaced_controller and job.
     *
     * @param registry registry to populate
     * @param application name of the application; when blank the tag is read from the context
     */
    public static void register(TagRegistry registry, String application) {
        if (StringUtils.isNotBlank(application)) {
            registry.register(APPLICATION, TagHandler.staticValue(application));
        }
        registry.register(PID, TagHandler.supplier(() -> ProcessHandle.current().pid()));
        registry.register(CONTROLLER, TagHandler.fromContext(context -> shortName(context.get(CONTROLLER))));
        registry.register(ACTION, TagHandler.fromContext(context -> context.get(ACTION)));
        registry.register(NAMESPACED_CONTROLLER, TagHandler.fromContext(context -> qualifiedName(context.get(CONTROLLER))));
        registry.register(JOB, TagHandler.fromContext(context -> qualifiedName(context.get(JOB))));
    }

    // a controller object is shown by its simple class name
    static Object shortName(Object value) {
        if (value == null || value instanceof CharSequence) return value;
        return value.getClass().getSimpleName();
    }

    static Object qualifiedName(Object value) {
        if (value == null || value instanceof CharSequence) return value;
        return value.getClass().getName();
    }
}
