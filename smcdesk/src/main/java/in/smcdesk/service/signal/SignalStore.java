package in.smcdesk.service.signal;

import in.smcdesk.domain.signal.Signal;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Recently generated signals, oldest evicted first.
 */
public final class SignalStore {

    public static final int DEFAULT_CAPACITY = 500;

    private final Map<String, Signal> signals;

    public SignalStore(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive: " + capacity);
        }
        this.signals = Collections.synchronizedMap(new LinkedHashMap<>(16, 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Signal> eldest) {
                return size() > capacity;
            }
        });
    }

    public SignalStore() {
        this(DEFAULT_CAPACITY);
    }

    public void save(Signal signal) {
        signals.put(signal.signalId(), signal);
    }

    public Optional<Signal> findById(String signalId) {
        return Optional.ofNullable(signals.get(signalId));
    }

    /**
     * Newest first.
     */
    public List<Signal> list(int limit) {
        List<Signal> all;
        synchronized (signals) {
            all = new ArrayList<>(signals.values());
        }
        Collections.reverse(all);
        return all.size() > limit ? all.subList(0, limit) : all;
    }

    public int size() {
        return signals.size();
    }
}
