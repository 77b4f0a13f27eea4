package com.vibecoding.pvecheck.client;

import com.vibecoding.pvecheck.model.ResourceObject;

import java.util.List;

/**
 * 클러스터 관리 API 클라이언트
 */
public interface ClusterApiClient {
    /**
     * 인증 티켓 발급. 실패하면 false (예외를 던지지 않음)
     */
    boolean login();

    /**
     * 발급받은 티켓이 아직 유효한지 확인
     */
    boolean checkLoginTicket();

    ApiVersion apiVersion();

    /**
     * API 경로(/cluster/resources 등)의 data 배열을 객체 목록으로 반환
     */
    List<ResourceObject> get(String path);

    String getHost();
}
