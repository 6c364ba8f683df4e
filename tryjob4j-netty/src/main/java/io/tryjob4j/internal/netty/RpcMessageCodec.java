package io.tryjob4j.internal.netty;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.DecoderException;
import io.netty.handler.codec.MessageToMessageCodec;

import java.io.IOException;
import java.util.List;
import java.util.Objects;

/**
 * Maps text lines to {@link RpcMessage}s and back. Sits after the line framing and string codecs.
 */
@ChannelHandler.Sharable
public class RpcMessageCodec extends MessageToMessageCodec<String, RpcMessage> {

    private final ObjectMapper objectMapper;

    public RpcMessageCodec(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    @Override
    protected void encode(ChannelHandlerContext ctx, RpcMessage msg, List<Object> out) throws Exception {
        // Jackson escapes line breaks inside strings, so one message is always one line
        out.add(objectMapper.writeValueAsString(msg) + "\n");
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, String line, List<Object> out) {
        if (line.isBlank()) {
            return;
        }
        try {
            out.add(objectMapper.readValue(line, RpcMessage.class));
        } catch (IOException e) {
            throw new DecoderException("unreadable frame: " + e.getMessage(), e);
        }
    }
}
