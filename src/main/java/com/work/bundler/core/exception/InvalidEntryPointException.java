package com.work.bundler.core.exception;

/**
 * 请求携带的 EntryPoint 与配置不一致。
 */
public class InvalidEntryPointException extends OperationRejectedException {

    public InvalidEntryPointException(String entryPoint) {
        super("Invalid entry point: " + entryPoint);
    }
}
