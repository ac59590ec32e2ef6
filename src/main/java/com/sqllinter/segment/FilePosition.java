package com.sqllinter.segment;

/**
 * 源文件中的位置：行号与列号从 1 开始，字符偏移从 0 开始。
 */
public record FilePosition(int lineNo, int linePos, int charPos) {

    public static final FilePosition START = new FilePosition(1, 1, 0);

    /**
     * 计算跨过指定文本后的位置。
     */
    public FilePosition advance(String text) {
        int line = lineNo;
        int column = linePos;
        for (int index = 0; index < text.length(); index++) {
            if (text.charAt(index) == '\n') {
                line++;
                column = 1;
            } else {
                column++;
            }
        }
        return new FilePosition(line, column, charPos + text.length());
    }
}
