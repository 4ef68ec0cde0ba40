package org.lupenghan.eazystorage.query.models;

import org.lupenghan.eazystorage.exceptions.NotFoundException;

import java.util.List;

/**
 * 查询中可以引用的表（物理表或别名）及其输出字段
 */
public interface TableIdentifier {

    /**
     * 标识路径，如 [users] 或 [t_3]
     */
    List<String> raw();

    String getAlias();

    List<FieldIdentifier> getOutputs();

    TableIdentifier withAlias();

    default FieldIdentifier getOutput(String name) {
        for (FieldIdentifier output : getOutputs()) {
            if (output.getName().equals(name)) {
                return output;
            }
        }
        throw new NotFoundException("Output " + name + " not found in " + String.join(".", raw()));
    }

    default boolean hasOutput(String name) {
        for (FieldIdentifier output : getOutputs()) {
            if (output.getName().equals(name)) {
                return true;
            }
        }
        return false;
    }
}
