package org.lupenghan.eazystorage.table.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.lupenghan.eazystorage.exceptions.SchemaInvariantException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 字段类型。编码形式为 {@code <type>[:<modifier>]}，例如 {@code int:unsigned}、
 * {@code string:255}、{@code enum:draft,published}。
 */
@Getter
@EqualsAndHashCode
public class FieldType {
    public static final String MODIFIER_SEPARATOR = ":";
    public static final String OPTION_SEPARATOR = ",";
    private static final String UNSIGNED = "unsigned";

    private final DataType dataType;
    private final boolean unsigned;
    private final int length;
    private final List<String> options;

    private FieldType(DataType dataType, boolean unsigned, int length, List<String> options) {
        this.dataType = dataType;
        this.unsigned = unsigned;
        this.length = length;
        this.options = Collections.unmodifiableList(new ArrayList<>(options));
    }

    public static FieldType integer(boolean unsigned) {
        return new FieldType(DataType.INT, unsigned, DataType.INT.getDefaultLength(), List.of());
    }

    public static FieldType longInteger(boolean unsigned) {
        return new FieldType(DataType.LONG, unsigned, DataType.LONG.getDefaultLength(), List.of());
    }

    public static FieldType dbl() {
        return new FieldType(DataType.DOUBLE, false, DataType.DOUBLE.getDefaultLength(), List.of());
    }

    public static FieldType bool() {
        return new FieldType(DataType.BOOLEAN, false, DataType.BOOLEAN.getDefaultLength(), List.of());
    }

    public static FieldType string(int length) {
        if (length <= 0) {
            throw new SchemaInvariantException("String length must be positive, got " + length);
        }
        return new FieldType(DataType.STRING, false, length, List.of());
    }

    public static FieldType text() {
        return new FieldType(DataType.TEXT, false, -1, List.of());
    }

    /**
     * 枚举类型。选项以逗号拼接保存，所以任何选项都不能包含逗号。
     */
    public static FieldType enumeration(List<String> options) {
        for (String option : options) {
            if (option.contains(OPTION_SEPARATOR)) {
                throw new SchemaInvariantException("Enum option may not contain '" + OPTION_SEPARATOR + "': " + option);
            }
        }
        return new FieldType(DataType.ENUM, false, -1, options);
    }

    @JsonValue
    public String encode() {
        return switch (dataType) {
            case INT, LONG -> unsigned ? dataType.getCode() + MODIFIER_SEPARATOR + UNSIGNED : dataType.getCode();
            case STRING -> dataType.getCode() + MODIFIER_SEPARATOR + length;
            case ENUM -> dataType.getCode() + MODIFIER_SEPARATOR + String.join(OPTION_SEPARATOR, options);
            default -> dataType.getCode();
        };
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static FieldType parse(String encoded) {
        int split = encoded.indexOf(MODIFIER_SEPARATOR);
        String code = split < 0 ? encoded : encoded.substring(0, split);
        String modifier = split < 0 ? "" : encoded.substring(split + 1);

        DataType type = DataType.fromCode(code);
        return switch (type) {
            case INT -> integer(UNSIGNED.equals(modifier));
            case LONG -> longInteger(UNSIGNED.equals(modifier));
            case DOUBLE -> dbl();
            case BOOLEAN -> bool();
            case STRING -> string(Integer.parseInt(modifier));
            case TEXT -> text();
            case ENUM -> enumeration(modifier.isEmpty() ? List.of() : Arrays.asList(modifier.split(OPTION_SEPARATOR)));
        };
    }

    @Override
    public String toString() {
        return encode();
    }
}
