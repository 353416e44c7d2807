package caseflow.coordinator.notify;

import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.QueryStringDecoder;
import io.netty.util.ReferenceCountUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;

import static io.netty.handler.codec.http.HttpResponseStatus.UNAUTHORIZED;
import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;

/**
 * Authenticates the WebSocket upgrade request before the handshake.
 * The bearer credential comes from the Authorization header or the {@code token}
 * query parameter. Requests for other paths pass through untouched.
 */
@Sharable
public class LiveChannelAuthHandler extends ChannelInboundHandlerAdapter {

    private static final Logger log = LoggerFactory.getLogger(LiveChannelAuthHandler.class);

    private final String websocketPath;
    private final TokenVerifier verifier;

    public LiveChannelAuthHandler(String websocketPath, TokenVerifier verifier) {
        this.websocketPath = websocketPath;
        this.verifier = verifier;
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) {
        if (!(msg instanceof FullHttpRequest req)) {
            ctx.fireChannelRead(msg);
            return;
        }

        QueryStringDecoder query = new QueryStringDecoder(req.uri());
        if (!isLivePath(query.path())) {
            ctx.fireChannelRead(msg);
            return;
        }

        Optional<String> userId = verifier.verify(token(req, query));
        if (userId.isEmpty()) {
            log.warn("Rejected live channel connection from {}", ctx.channel().remoteAddress());
            ReferenceCountUtil.release(req);
            byte[] body = "{\"error\":\"unauthorized\"}".getBytes(StandardCharsets.UTF_8);
            FullHttpResponse response = new DefaultFullHttpResponse(HTTP_1_1, UNAUTHORIZED,
                    Unpooled.wrappedBuffer(body));
            response.headers().set(HttpHeaderNames.CONTENT_TYPE, "application/json; charset=utf-8");
            response.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, body.length);
            ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
            return;
        }

        ctx.channel().attr(SubscriptionRegistry.USER_ID).set(userId.get());
        ctx.fireChannelRead(msg);
    }

    private boolean isLivePath(String path) {
        return path.equals(websocketPath) || path.startsWith(websocketPath + "/");
    }

    static String token(FullHttpRequest req, QueryStringDecoder query) {
        String header = req.headers().get(HttpHeaderNames.AUTHORIZATION);
        if (header != null && header.regionMatches(true, 0, "Bearer ", 0, 7)) {
            return header.substring(7).trim();
        }
        List<String> fromQuery = query.parameters().get("token");
        return fromQuery == null || fromQuery.isEmpty() ? null : fromQuery.get(0);
    }
}
