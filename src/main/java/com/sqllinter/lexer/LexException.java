package com.sqllinter.lexer;

import com.sqllinter.config.Constants;
import com.sqllinter.segment.FilePosition;

/**
 * 没有任何词法规则能匹配某个位置时抛出，对该文件是致命错误。
 */
public class LexException extends RuntimeException {
    private final FilePosition position;
    private final String excerpt;

    public LexException(String message, FilePosition position, String source) {
        super(buildMessage(message, position, source));
        this.position = position;
        this.excerpt = excerptAround(position.charPos(), source);
    }

    public FilePosition getPosition() {
        return position;
    }

    public String getExcerpt() {
        return excerpt;
    }

    private static String buildMessage(String message, FilePosition position, String source) {
        return "词法错误，位于第 " + position.lineNo() + " 行第 " + position.linePos()
                + " 列（偏移 " + position.charPos() + "）: " + message + System.lineSeparator()
                + excerptAround(position.charPos(), source);
    }

    private static String excerptAround(int offset, String source) {
        if (source == null || source.isEmpty()) {
            return "";
        }
        int lineStart = source.lastIndexOf('\n', Math.max(0, offset - 1)) + 1;
        if (offset == 0) {
            lineStart = 0;
        }
        int lineEnd = source.indexOf('\n', offset);
        if (lineEnd < 0) {
            lineEnd = source.length();
        }
        int from = Math.max(lineStart, offset - Constants.ERROR_CONTEXT_CHARS);
        int to = Math.min(lineEnd, offset + Constants.ERROR_CONTEXT_CHARS);
        String pointer = " ".repeat(offset - from) + "^";
        return source.substring(from, to) + System.lineSeparator() + pointer;
    }
}
