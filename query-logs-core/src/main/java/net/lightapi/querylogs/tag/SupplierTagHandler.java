package net.lightapi.querylogs.tag;

import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

public class SupplierTagHandler implements TagHandler {
    private final Supplier<?> supplier;

    public SupplierTagHandler(Supplier<?> supplier) {
        this.supplier = Objects.requireNonNull(supplier, "supplier");
    }

    // the context is never passed to a supplier
    @Override
    public Object resolve(Map<String, Object> context) {
        return supplier.get();
    }
}
