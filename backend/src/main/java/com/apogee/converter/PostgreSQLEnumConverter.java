package com.apogee.converter;

import com.apogee.entity.LabeledEnum;
import jakarta.persistence.AttributeConverter;
import java.sql.SQLException;
import org.postgresql.util.PGobject;

/**
 * Generic PostgreSQL enum converter for Hibernate. Writes the enum label as a typed {@link
 * PGobject} so the value binds to the native enum column without a cast.
 *
 * @param <T> The Java enum type
 */
public abstract class PostgreSQLEnumConverter<T extends Enum<T> & LabeledEnum>
        implements AttributeConverter<T, Object> {

    private final Class<T> enumClass;
    private final String postgresType;

    /**
     * @param enumClass The Java enum class
     * @param postgresType The PostgreSQL enum type name (e.g., "video_status")
     */
    protected PostgreSQLEnumConverter(Class<T> enumClass, String postgresType) {
        this.enumClass = enumClass;
        this.postgresType = postgresType;
    }

    @Override
    public Object convertToDatabaseColumn(T attribute) {
        if (attribute == null) {
            return null;
        }

        try {
            PGobject pgObject = new PGobject();
            pgObject.setType(postgresType);
            pgObject.setValue(attribute.getLabel());
            return pgObject;
        } catch (SQLException e) {
            throw new IllegalStateException(
                    String.format(
                            "Cannot bind %s value %s", postgresType, attribute.getLabel()),
                    e);
        }
    }

    @Override
    public T convertToEntityAttribute(Object dbData) {
        if (dbData == null) {
            return null;
        }

        String value;
        if (dbData instanceof PGobject pgObject) {
            value = pgObject.getValue();
        } else {
            value = dbData.toString();
        }

        try {
            return LabeledEnum.fromLabel(enumClass, value);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    String.format("Unknown %s value: %s", postgresType, value), e);
        }
    }
}
