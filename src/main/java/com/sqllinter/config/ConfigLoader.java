package com.sqllinter.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 从 JSON 配置文件加载检查器配置。
 */
public final class ConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private ConfigLoader() {
    }

    /**
     * 读取指定配置文件；未找到文件时返回默认配置。
     *
     * @param configFile 配置文件路径，可为 null
     * @return 合并默认值后的配置
     * @throws IOException 文件存在但读取或解析失败时抛出
     */
    public static LinterConfig load(Path configFile) throws IOException {
        if (configFile == null || !Files.isRegularFile(configFile)) {
            logger.debug("未找到配置文件 {}，使用默认配置", configFile);
            return LinterConfig.defaults();
        }
        // readerForUpdating 只覆盖文件里出现的字段，其余保持默认值
        ObjectReader reader = OBJECT_MAPPER.readerForUpdating(LinterConfig.defaults());
        try {
            LinterConfig config = reader.readValue(configFile.toFile());
            logger.debug("已加载配置文件 {}", configFile);
            return config;
        } catch (IOException exception) {
            throw new IOException("读取配置文件失败: " + configFile.toAbsolutePath(), exception);
        }
    }

    /**
     * 在工作目录中查找默认配置文件名并加载。
     */
    public static LinterConfig loadFromDirectory(Path directory) throws IOException {
        if (directory == null) {
            return LinterConfig.defaults();
        }
        return load(directory.resolve(Constants.CONFIG_FILE_NAME));
    }
}
