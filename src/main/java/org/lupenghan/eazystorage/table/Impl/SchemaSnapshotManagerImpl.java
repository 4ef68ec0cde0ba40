package org.lupenghan.eazystorage.table.Impl;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.lupenghan.eazystorage.table.interfaces.SchemaSnapshotManager;
import org.lupenghan.eazystorage.table.models.Schema;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 把结构快照保存为一个 JSON 文件。
 * 生命周期钩子不写入文件，加载后由各表的 conventions 在第一次使用时重建。
 */
@Slf4j
public class SchemaSnapshotManagerImpl implements SchemaSnapshotManager {
    @Getter
    private final Path file;
    private final ObjectMapper mapper;

    public SchemaSnapshotManagerImpl(Path file) {
        this.file = file;
        this.mapper = createMapper();
    }

    static ObjectMapper createMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.setVisibility(PropertyAccessor.ALL, JsonAutoDetect.Visibility.NONE);
        mapper.setVisibility(PropertyAccessor.FIELD, JsonAutoDetect.Visibility.ANY);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }

    @Override
    public boolean exists() {
        return Files.isRegularFile(file);
    }

    @Override
    public Schema load() throws IOException {
        Schema schema = mapper.readValue(file.toFile(), Schema.class);
        log.info("加载结构快照 {}，共 {} 张表", file, schema.getLayouts().size());
        return schema;
    }

    @Override
    public void save(Schema schema) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        mapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), schema);
        log.info("结构快照已保存到 {}", file);
    }
}
