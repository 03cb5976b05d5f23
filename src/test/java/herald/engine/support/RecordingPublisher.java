package herald.engine.support;

import herald.engine.dispatch.PlatformPublisher;
import herald.engine.dispatch.PublishRequest;
import herald.engine.dispatch.PublishResult;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Stub publisher that records every request and answers with a canned behaviour.
 */
public final class RecordingPublisher implements PlatformPublisher {

    private final List<PublishRequest> requests = new CopyOnWriteArrayList<>();
    private final Function<PublishRequest, PublishResult> answer;
    private final Duration delay;
    private volatile CountDownLatch calls = new CountDownLatch(1);

    private RecordingPublisher(Function<PublishRequest, PublishResult> answer, Duration delay) {
        this.answer = answer;
        this.delay = delay;
    }

    /** Succeeds with {@code {"postId": "post-<taskId>"}}. */
    public static RecordingPublisher succeeding() {
        return new RecordingPublisher(req -> PublishResult.success(Map.of("postId", "post-" + req.taskId())),
                Duration.ZERO);
    }

    public static RecordingPublisher failing(String error) {
        return new RecordingPublisher(req -> PublishResult.failure(error), Duration.ZERO);
    }

    public static RecordingPublisher throwing(RuntimeException e) {
        return new RecordingPublisher(req -> {
            throw e;
        }, Duration.ZERO);
    }

    /** Sleeps before succeeding; used to provoke dispatch timeouts. */
    public static RecordingPublisher slow(Duration delay) {
        return new RecordingPublisher(req -> PublishResult.success(Map.of("late", true)), delay);
    }

    @Override
    public PublishResult publish(PublishRequest request) throws InterruptedException {
        requests.add(request);
        calls.countDown();
        if (!delay.isZero()) {
            Thread.sleep(delay.toMillis());
        }
        return answer.apply(request);
    }

    public List<PublishRequest> requests() {
        return requests;
    }

    public int callCount() {
        return requests.size();
    }

    /** Wait for the first call. */
    public boolean awaitCall(long timeout, TimeUnit unit) throws InterruptedException {
        return calls.await(timeout, unit);
    }
}
