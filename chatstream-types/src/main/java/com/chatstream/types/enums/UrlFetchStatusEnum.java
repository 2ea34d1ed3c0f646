package com.chatstream.types.enums;

/**
 * 单个 URL 的抓取进度。
 */
public enum UrlFetchStatusEnum {
    FETCHING,
    FETCHED
}
