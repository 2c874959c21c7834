package dev.resumematcher.entity;

import dev.resumematcher.model.EmbeddingVector;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Stores an embedding as little-endian IEEE-754 floats.
 */
@Converter
public class EmbeddingVectorConverter implements AttributeConverter<EmbeddingVector, byte[]> {

    @Override
    public byte[] convertToDatabaseColumn(EmbeddingVector vector) {
        if (vector == null) {
            return null;
        }
        float[] values = vector.values();
        ByteBuffer buffer = ByteBuffer.allocate(values.length * Float.BYTES).order(ByteOrder.LITTLE_ENDIAN);
        for (float value : values) {
            buffer.putFloat(value);
        }
        return buffer.array();
    }

    @Override
    public EmbeddingVector convertToEntityAttribute(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            return null;
        }
        if (bytes.length % Float.BYTES != 0) {
            throw new IllegalArgumentException("Stored embedding has " + bytes.length
                    + " bytes, not a multiple of " + Float.BYTES);
        }
        ByteBuffer buffer = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
        float[] values = new float[bytes.length / Float.BYTES];
        for (int i = 0; i < values.length; i++) {
            values[i] = buffer.getFloat();
        }
        return new EmbeddingVector(values);
    }
}
