package com.hcltech.typedkafka.common.codec;

import com.hcltech.typedkafka.common.errorsor.ErrorsOr;

import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.ByteBuffer;
import java.util.Objects;

public final class StringToBytesCodec<T> implements Codec<T, byte[]> {
    private final Codec<T, String> delegate;
    private final Charset charset;

    public StringToBytesCodec(Codec<T, String> delegate) {
        this(delegate, StandardCharsets.UTF_8);
    }

    public StringToBytesCodec(Codec<T, String> delegate, Charset charset) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.charset = Objects.requireNonNull(charset, "charset");
    }

    @Override
    public ErrorsOr<byte[]> encode(T from) {
        try {
            return delegate.encode(from).map(x -> x.getBytes(charset));
        } catch (Exception e) {
            return ErrorsOr.error("Failed to encode to bytes: " + e.getMessage());
        }
    }

    // Malformed input is reported instead of being replaced with U+FFFD.
    @Override
    public ErrorsOr<T> decode(byte[] to) {
        if (to == null) return ErrorsOr.error("Failed to decode from bytes: input is null");
        try {
            String s = charset.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(to))
                    .toString();
            return delegate.decode(s);
        } catch (CharacterCodingException e) {
            return ErrorsOr.error("Failed to decode from bytes: not valid " + charset.name());
        }
    }
}
