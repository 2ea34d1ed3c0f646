package com.chatstream.types.enums;

/**
 * 附件（URL 抓取等）处理状态。
 */
public enum AttachmentStatusEnum {
    IDLE,
    PROCESSING,
    COMPLETE,
    ERROR
}
