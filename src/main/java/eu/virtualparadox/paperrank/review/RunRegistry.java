package eu.virtualparadox.paperrank.review;

import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

@Service
public class RunRegistry {

    private final AtomicLong counter;
    private final Map<Long, ReviewRun> runs;

    public RunRegistry() {
        this.counter = new AtomicLong(0);
        this.runs = new ConcurrentHashMap<>();
    }

    public ReviewRun createRun(ReviewRequest request) {
        long id = counter.incrementAndGet();
        ReviewRun run = new ReviewRun(id, request);
        runs.put(id, run);
        return run;
    }

    public Optional<ReviewRun> getRun(long id) {
        return Optional.ofNullable(runs.get(id));
    }

    public boolean cancel(long id) {
        ReviewRun run = runs.get(id);
        if (run == null || run.getStatus().isTerminal()) {
            return false;
        }
        run.cancel();
        return true;
    }
}
