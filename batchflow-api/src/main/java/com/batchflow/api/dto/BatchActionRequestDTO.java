package com.batchflow.api.dto;

import lombok.Data;

import java.util.List;

/**
 * 批量操作请求 DTO。
 */
@Data
public class BatchActionRequestDTO {

    private String action;
    private List<Long> jobIds;
}
