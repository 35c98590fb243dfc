package com.astxlang.cli;

/**
 * JSON 树格式错误
 */
public class TreeFormatException extends RuntimeException {
    private final String path;

    public TreeFormatException(String message, String path) {
        super(message);
        this.path = path;
    }

    public TreeFormatException(String message, String path, Throwable cause) {
        super(message, cause);
        this.path = path;
    }

    /** 出错节点在 JSON 中的路径，如 {@code $.statements[0].body} */
    public String getPath() {
        return path;
    }

    @Override
    public String getMessage() {
        return super.getMessage() + " at " + path;
    }
}
