package io.github.byzatic.pushscheduler.notifier;

import io.github.byzatic.pushscheduler.base_exceptions.DeliveryFailureException;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Test notifier: records every call and answers with a configurable outcome.
 */
public class RecordingNotifier implements Notifier {

    public static final class Call {
        public final String content;
        public final String credential;

        Call(String content, String credential) {
            this.content = content;
            this.credential = credential;
        }
    }

    private final List<Call> calls = new CopyOnWriteArrayList<>();
    private volatile Exception failure = null;
    private volatile CountDownLatch entered = null;
    private volatile CountDownLatch release = null;

    public RecordingNotifier failWith(Exception failure) {
        this.failure = failure;
        return this;
    }

    /**
     * Every call counts down {@code entered} and then blocks until {@code release} opens.
     */
    public RecordingNotifier blockUntil(CountDownLatch entered, CountDownLatch release) {
        this.entered = entered;
        this.release = release;
        return this;
    }

    @Override
    public void deliver(@NotNull String content, @NotNull String credential) throws DeliveryFailureException {
        calls.add(new Call(content, credential));
        if (entered != null) entered.countDown();
        if (release != null) {
            try {
                if (!release.await(5, TimeUnit.SECONDS)) throw new DeliveryFailureException("never released");
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new DeliveryFailureException(e);
            }
        }
        Exception f = failure;
        if (f instanceof DeliveryFailureException) throw (DeliveryFailureException) f;
        if (f instanceof RuntimeException) throw (RuntimeException) f;
        if (f != null) throw new DeliveryFailureException(f);
    }

    public List<Call> calls() {
        return calls;
    }

    public long callsFor(String content) {
        return calls.stream().filter(c -> c.content.equals(content)).count();
    }
}
