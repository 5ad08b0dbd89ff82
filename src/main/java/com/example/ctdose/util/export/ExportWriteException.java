package com.example.ctdose.util.export;

import java.io.IOException;

/**
 * 单个输出文件写入失败
 *
 * 只影响该文件，内存中的结果和其它输出文件不受影响。
 */
public class ExportWriteException extends IOException {

    private final String target;

    public ExportWriteException(String target, String message, Throwable cause) {
        super(message, cause);
        this.target = target;
    }

    /**
     * @return 写入失败的文件路径
     */
    public String getTarget() {
        return target;
    }
}
