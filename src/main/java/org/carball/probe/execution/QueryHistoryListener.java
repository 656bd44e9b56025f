package org.carball.probe.execution;

@FunctionalInterface
public interface QueryHistoryListener {

    void onQuery(QueryHistoryEntry entry);
}
