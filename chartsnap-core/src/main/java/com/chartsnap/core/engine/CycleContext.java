package com.chartsnap.core.engine;

import com.chartsnap.core.model.CaptureResult;
import com.chartsnap.core.model.Surface;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * State scoped to one capture cycle: charts opened by the cycle and per-timeframe results.
 * Created at cycle start and discarded at cycle end.
 */
public class CycleContext {

    private final String symbol;
    private final Set<Long> createdHandles = new LinkedHashSet<>();
    private final List<CaptureResult> results = new ArrayList<>();

    public CycleContext(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * Take ownership of a chart opened during this cycle.
     */
    public void markCreated(Surface surface) {
        createdHandles.add(surface.handle());
    }

    public boolean isCreated(long handle) {
        return createdHandles.contains(handle);
    }

    public Set<Long> getCreatedHandles() {
        return Collections.unmodifiableSet(createdHandles);
    }

    public void clearCreated() {
        createdHandles.clear();
    }

    public void addResult(CaptureResult result) {
        results.add(result);
    }

    public List<CaptureResult> getResults() {
        return Collections.unmodifiableList(results);
    }

    public int getSuccessCount() {
        int count = 0;
        for (CaptureResult r : results) {
            if (r.success()) count++;
        }
        return count;
    }
}
