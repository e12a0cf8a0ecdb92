package com.tightzone.data.http;

import com.tightzone.core.ScreenerException;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

/**
 * 模块说明：HttpClientEx（class）。
 * 主要职责：封装 JDK HttpClient，统一超时、User-Agent 与非 2xx 状态的失败语义。
 * 使用建议：测试中可继承本类并覆写 getText/postJson，避免真实网络访问。
 */
public class HttpClientEx {
    private final HttpClient client;
    private final String userAgent;

    public HttpClientEx() {
        this("TightZone/1.0");
    }

    public HttpClientEx(String userAgent) {
        this.client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(20))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        this.userAgent = userAgent == null || userAgent.isBlank() ? "TightZone/1.0" : userAgent.trim();
    }

/**
 * 方法说明：getText，负责发起 GET 请求并返回响应正文。
 * 处理流程：网络异常、超时与非 2xx 状态统一转换为 TRANSPORT 类失败。
 */
    public String getText(String url, int timeoutSeconds) {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(Duration.ofSeconds(Math.max(1, timeoutSeconds)))
                .GET()
                .header("User-Agent", userAgent)
                .header("Accept", "application/json")
                .build();
        return send(req, url);
    }

/**
 * 方法说明：postJson，负责以 JSON 正文发起 POST 请求。
 */
    public String postJson(String url, String json, int timeoutSeconds) {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(Duration.ofSeconds(Math.max(1, timeoutSeconds)))
                .POST(HttpRequest.BodyPublishers.ofString(json))
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .header("User-Agent", userAgent)
                .build();
        return send(req, url);
    }

    private String send(HttpRequest req, String url) {
        HttpResponse<String> resp;
        try {
            resp = client.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw ScreenerException.transport("timeout for " + url, e);
        } catch (IOException e) {
            String reason = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            throw ScreenerException.transport(reason + " for " + url, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw ScreenerException.cancelled("interrupted while requesting " + url);
        }
        if (resp.statusCode() >= 200 && resp.statusCode() < 300) return resp.body();
        throw ScreenerException.transport("HTTP " + resp.statusCode() + " for " + url, null);
    }
}
