package io.taskrelay.transport.jsonrpc.handler;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Flow;
import java.util.concurrent.TimeUnit;

import io.taskrelay.spec.JSONRPCResponse;

/**
 * Records the responses a streaming method publishes.
 */
class ResponseRecorder implements Flow.Subscriber<JSONRPCResponse<?>> {

    private final List<JSONRPCResponse<?>> items = new CopyOnWriteArrayList<>();
    private final CountDownLatch done = new CountDownLatch(1);
    private volatile boolean completed;
    private volatile Throwable error;

    @SuppressWarnings("unchecked")
    static ResponseRecorder subscribe(Flow.Publisher<? extends JSONRPCResponse<?>> publisher) {
        ResponseRecorder recorder = new ResponseRecorder();
        ((Flow.Publisher<JSONRPCResponse<?>>) publisher).subscribe(recorder);
        return recorder;
    }

    @Override
    public void onSubscribe(Flow.Subscription subscription) {
        subscription.request(Long.MAX_VALUE);
    }

    @Override
    public void onNext(JSONRPCResponse<?> item) {
        items.add(item);
    }

    @Override
    public void onError(Throwable throwable) {
        error = throwable;
        done.countDown();
    }

    @Override
    public void onComplete() {
        completed = true;
        done.countDown();
    }

    boolean awaitDone() throws InterruptedException {
        return done.await(10, TimeUnit.SECONDS);
    }

    List<JSONRPCResponse<?>> getItems() {
        return items;
    }

    boolean isCompleted() {
        return completed;
    }

    Throwable getError() {
        return error;
    }
}
