package com.example.hookhub.server.controller;

import com.example.hookhub.server.websocket.TunnelHub;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * 隧道状态查询 API
 */
@RestController
@RequestMapping("/__hookhub__")
@RequiredArgsConstructor
public class TunnelController {

    private final TunnelHub hub;

    /**
     * 获取活跃连接数统计
     */
    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> getStats() {
        return ResponseEntity.ok(Map.of(
                "activeConnections", hub.getActiveConnectionCount()));
    }
}
