package com.websearch.cli;

/**
 * 命令行退出码。零结果查询属于成功。
 */
public final class ExitCodes {
    public static final int OK = 0;
    public static final int INTERNAL_ERROR = 1;
    public static final int CONFIG_ERROR = 2;
    public static final int INDEX_MISSING = 3;

    private ExitCodes() {
    }
}
