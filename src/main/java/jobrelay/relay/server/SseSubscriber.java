package jobrelay.relay.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.handler.codec.http.DefaultHttpContent;
import io.netty.handler.codec.http.DefaultHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpResponse;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.codec.http.LastHttpContent;
import jobrelay.relay.hub.JobSubscriber;
import jobrelay.relay.hub.SubscriberGoneException;
import jobrelay.relay.model.JobEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link JobSubscriber} writing Server-Sent Events to a Netty channel.
 *
 * Each event becomes one {@code data: <json>\n\n} chunk of a chunked HTTP response.
 * Writes are queued on the channel's event loop, so {@link #send} never waits on the peer;
 * a write that stays pending too long trips the pipeline's write timeout and closes the channel.
 */
public class SseSubscriber implements JobSubscriber {

    private static final Logger log = LoggerFactory.getLogger(SseSubscriber.class);

    private final Channel channel;
    private final String id;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public SseSubscriber(Channel channel) {
        this.channel = channel;
        this.id = "sse-" + channel.id().asShortText();
    }

    /** Response head that switches the connection to an event stream */
    public static HttpResponse streamHeaders() {
        HttpResponse response = new DefaultHttpResponse(HttpVersion.HTTP_1_1, HttpResponseStatus.OK);
        response.headers()
                .set(HttpHeaderNames.CONTENT_TYPE, "text/event-stream")
                .set(HttpHeaderNames.CACHE_CONTROL, "no-cache, no-transform")
                .set(HttpHeaderNames.CONNECTION, HttpHeaderValues.KEEP_ALIVE)
                .set("X-Accel-Buffering", "no");
        HttpUtil.setTransferEncodingChunked(response, true);
        return response;
    }

    /** Encode one event as an SSE frame */
    static String frame(JobEvent event) {
        try {
            return "data: " + RouterHandler.mapper().writeValueAsString(event) + "\n\n";
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot encode " + event.type().wireName() + " event", e);
        }
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public void send(JobEvent event) throws SubscriberGoneException {
        if (closed.get() || !channel.isActive()) {
            throw new SubscriberGoneException(id + " is closed");
        }
        byte[] bytes = frame(event).getBytes(StandardCharsets.UTF_8);
        channel.writeAndFlush(new DefaultHttpContent(Unpooled.wrappedBuffer(bytes)))
                .addListener((ChannelFutureListener) future -> {
                    if (!future.isSuccess()) {
                        log.debug("{} write failed: {}", id, future.cause().getMessage());
                        future.channel().close();
                    }
                });
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        if (channel.isActive()) {
            channel.writeAndFlush(LastHttpContent.EMPTY_LAST_CONTENT).addListener(ChannelFutureListener.CLOSE);
        } else {
            channel.close();
        }
    }

    @Override
    public String toString() {
        return id;
    }
}
