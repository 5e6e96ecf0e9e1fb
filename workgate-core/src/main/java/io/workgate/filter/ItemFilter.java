package io.workgate.filter;

import io.workgate.model.WorkItem;

import java.util.List;

/**
 * One stage of a {@link FilterPipeline}.
 *
 * <p>Implementations return the surviving items in input order and must not throw on a
 * dependency failure; they degrade according to their own failure policy instead.
 */
public interface ItemFilter {

    String name();

    List<WorkItem> apply(List<WorkItem> items, FilterContext context);
}
