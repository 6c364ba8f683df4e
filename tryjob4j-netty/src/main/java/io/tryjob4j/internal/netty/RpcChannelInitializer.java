package io.tryjob4j.internal.netty;

import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.socket.SocketChannel;
import io.netty.handler.codec.LineBasedFrameDecoder;
import io.netty.handler.codec.string.StringDecoder;
import io.netty.handler.codec.string.StringEncoder;

import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Pipeline shared by both ends of the try RPC connection:
 * line framing, UTF-8 text, JSON frames, then the session handler.
 */
public class RpcChannelInitializer extends ChannelInitializer<SocketChannel> {

    // a frame carries a whole diff
    public static final int MAX_FRAME_LENGTH = 32 * 1024 * 1024;

    private final RpcMessageCodec codec;
    private final Supplier<? extends ChannelHandler> sessionHandler;

    public RpcChannelInitializer(RpcMessageCodec codec, Supplier<? extends ChannelHandler> sessionHandler) {
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
        this.sessionHandler = Objects.requireNonNull(sessionHandler, "sessionHandler must not be null");
    }

    @Override
    protected void initChannel(SocketChannel ch) {
        ch.pipeline()
                .addLast(new LineBasedFrameDecoder(MAX_FRAME_LENGTH))
                .addLast(new StringDecoder(StandardCharsets.UTF_8))
                .addLast(new StringEncoder(StandardCharsets.UTF_8))
                .addLast(codec)
                .addLast(sessionHandler.get());
    }
}
