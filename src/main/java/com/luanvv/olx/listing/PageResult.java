package com.luanvv.olx.listing;

import com.luanvv.olx.model.ListingBasic;
import java.util.List;
import java.util.Optional;

public final class PageResult {
    private final List<ListingBasic> items;
    private final Exception cause;

    private PageResult(List<ListingBasic> items, Exception cause) {
        this.items = items;
        this.cause = cause;
    }

    public static PageResult ok(List<ListingBasic> items) {
        return new PageResult(List.copyOf(items), null);
    }

    public static PageResult failed(Exception cause) {
        return new PageResult(List.of(), cause);
    }

    public boolean isFailure() {
        return cause != null;
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public List<ListingBasic> getItems() {
        return items;
    }

    public Optional<Exception> getCause() {
        return Optional.ofNullable(cause);
    }
}
