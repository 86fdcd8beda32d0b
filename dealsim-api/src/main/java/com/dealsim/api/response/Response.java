package com.dealsim.api.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * Uniform API envelope: response code, description and payload.
 *
 * @param <T> payload type
 * @author dealsim
 * @since 2026-03-02
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Response<T> implements Serializable {

    private static final long serialVersionUID = 4012087419825341770L;

    /** "0000" on success */
    private String code;

    private String info;

    private T data;

}
