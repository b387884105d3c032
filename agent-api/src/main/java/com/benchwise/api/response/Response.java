package com.benchwise.api.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * Response envelope shared by every endpoint.
 *
 * @param <T> payload type
 * @author benchwise
 * @since 2026-03-02
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Response<T> implements Serializable {

    private static final long serialVersionUID = 4389152734460194517L;

    /** "0000" on success */
    private String code;

    private String info;

    private T data;

}
