package net.lightapi.querylogs.tag;

/**
 * Provider listed in the test service.yml.
 */
public class RequestIdTagProvider implements QueryTagProvider {

    @Override
    public String getKey() {
        return "request_id";
    }

    @Override
    public TagHandler getHandler() {
        return TagHandler.fromContext(context -> context.get("requestId"));
    }
}
