package com.astxlang.transpiler;

/**
 * 后端配置。后端在构造时读取一次，之后的修改不影响已创建的后端。
 */
public class TranspilerConfig {
    private int indentSize = 4;
    private boolean useSpaces = true;
    private String indentUnit;  // 显式指定时优先

    public TranspilerConfig() {
    }

    /** 直接指定单层缩进字符串 */
    public static TranspilerConfig withIndentUnit(String indentUnit) {
        TranspilerConfig config = new TranspilerConfig();
        config.setIndentUnit(indentUnit);
        return config;
    }

    public int getIndentSize() {
        return indentSize;
    }

    public void setIndentSize(int indentSize) {
        if (indentSize < 0) {
            throw new IllegalArgumentException("indent size must not be negative: " + indentSize);
        }
        this.indentSize = indentSize;
    }

    public boolean isUseSpaces() {
        return useSpaces;
    }

    public void setUseSpaces(boolean useSpaces) {
        this.useSpaces = useSpaces;
    }

    public String getIndentUnit() {
        return indentUnit;
    }

    public void setIndentUnit(String indentUnit) {
        if (indentUnit != null && indentUnit.isEmpty()) {
            throw new IllegalArgumentException("indent unit must not be empty");
        }
        this.indentUnit = indentUnit;
    }

    /**
     * 获取单层缩进字符串
     */
    public String getIndentString() {
        if (indentUnit != null) {
            return indentUnit;
        }
        if (useSpaces) {
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < indentSize; i++) {
                sb.append(' ');
            }
            return sb.toString();
        } else {
            return "\t";
        }
    }
}
