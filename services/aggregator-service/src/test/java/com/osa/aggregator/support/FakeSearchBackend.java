package com.osa.aggregator.support;

import com.osa.aggregator.backend.ResultItem;
import com.osa.aggregator.backend.SearchBackend;
import com.osa.aggregator.backend.SearchOptions;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;

public class FakeSearchBackend implements SearchBackend {
    private final String id;
    private final BiFunction<String, SearchOptions, List<ResultItem>> behavior;
    private final AtomicInteger calls = new AtomicInteger();

    public FakeSearchBackend(String id, BiFunction<String, SearchOptions, List<ResultItem>> behavior) {
        this.id = id;
        this.behavior = behavior;
    }

    public static FakeSearchBackend returning(String id, String... urls) {
        List<ResultItem> items = new ArrayList<>();
        double score = 1.0;
        for (String url : urls) {
            items.add(new ResultItem(url, "title " + url, id, score));
            score -= 0.1;
        }
        return new FakeSearchBackend(id, (query, options) -> items);
    }

    public static FakeSearchBackend failing(String id, RuntimeException error) {
        return new FakeSearchBackend(id, (query, options) -> {
            throw error;
        });
    }

    public static FakeSearchBackend sleeping(String id, long sleepMs) {
        return new FakeSearchBackend(id, (query, options) -> {
            try {
                Thread.sleep(sleepMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return List.of(new ResultItem("https://" + id + ".example/slow", "slow", id, 0.1));
        });
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public List<ResultItem> search(String query, SearchOptions options) {
        calls.incrementAndGet();
        return behavior.apply(query, options);
    }

    public int getCalls() {
        return calls.get();
    }
}
