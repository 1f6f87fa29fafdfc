package net.lightapi.querylogs.jdbc;

import net.lightapi.querylogs.tag.QueryTagProvider;
import net.lightapi.querylogs.tag.TagHandler;

public class TenantTagProvider implements QueryTagProvider {

    @Override
    public String getKey() {
        return "tenant";
    }

    @Override
    public TagHandler getHandler() {
        return TagHandler.fromContext(context -> context.get("hostId"));
    }
}
