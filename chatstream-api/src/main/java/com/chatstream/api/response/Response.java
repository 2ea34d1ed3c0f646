package com.chatstream.api.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * 统一响应结果封装类。
 * <p>
 * 所有会话接口的返回值都包在该信封中：code 为 {@code ResponseCode} 中的响应码，
 * info 为描述信息，data 为业务数据。
 * </p>
 *
 * @param <T> 响应数据的类型
 * @author chatstream
 * @since 2026-03-02
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Response<T> implements Serializable {

    private static final long serialVersionUID = 3391874205527361022L;

    /** 响应码，成功为"0000" */
    private String code;

    /** 响应描述信息 */
    private String info;

    /** 响应数据 */
    private T data;

}
