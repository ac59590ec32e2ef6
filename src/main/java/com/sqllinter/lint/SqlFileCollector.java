package com.sqllinter.lint;

import com.sqllinter.config.Constants;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Stream;

/**
 * 从命令行给出的路径收集待检查的 SQL 文件：文件直接收录，目录递归查找 .sql 文件。
 */
public final class SqlFileCollector {

    private SqlFileCollector() {
    }

    public static List<Path> collect(List<Path> paths) throws IOException {
        Set<Path> files = new LinkedHashSet<>();
        for (Path path : paths) {
            if (Files.isRegularFile(path)) {
                files.add(path.normalize());
            } else if (Files.isDirectory(path)) {
                try (Stream<Path> stream = Files.walk(path)) {
                    stream.filter(Files::isRegularFile)
                            .filter(SqlFileCollector::isSqlFile)
                            .map(Path::normalize)
                            .sorted()
                            .forEach(files::add);
                }
            } else {
                throw new IOException("路径不存在: " + path);
            }
        }
        return new ArrayList<>(files);
    }

    static boolean isSqlFile(Path file) {
        return file.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(Constants.SQL_FILE_EXTENSION);
    }
}
