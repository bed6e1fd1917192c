package cn.bafuka.cranlens.example.client.impl;

import cn.bafuka.cranlens.core.CacheKeys;
import cn.bafuka.cranlens.example.client.RegistryClient;
import cn.bafuka.cranlens.example.config.LookupProperties;
import cn.bafuka.cranlens.example.exception.RegistryLookupException;
import cn.bafuka.cranlens.example.exception.RegistryLookupException.LookupFailureReason;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpMethod;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.net.SocketTimeoutException;
import java.util.Map;
import java.util.function.Supplier;

/**
 * 基于 RestTemplate 的注册中心客户端
 * 包信息来自 crandb，README 来自 CRAN 的 GitHub 镜像
 */
@Slf4j
public class HttpRegistryClient implements RegistryClient {

    private static final ParameterizedTypeReference<Map<String, Object>> JSON_OBJECT =
            new ParameterizedTypeReference<Map<String, Object>>() {
            };

    /**
     * GitHub 镜像中最新版本所在的分支
     */
    private static final String LATEST_REF = "master";

    private final RestTemplate restTemplate;

    private final LookupProperties properties;

    public HttpRegistryClient(RestTemplate restTemplate, LookupProperties properties) {
        this.restTemplate = restTemplate;
        this.properties = properties;
    }

    @Override
    public Map<String, Object> fetchPackage(String packageName) {
        String url = properties.getCrandbBaseUrl() + "/{name}";
        return execute("package " + packageName, () ->
                restTemplate.exchange(url, HttpMethod.GET, null, JSON_OBJECT, packageName).getBody());
    }

    @Override
    public Map<String, Object> fetchPackageIndex() {
        String url = properties.getCrandbBaseUrl() + "/-/desc";
        return execute("package index", () ->
                restTemplate.exchange(url, HttpMethod.GET, null, JSON_OBJECT).getBody());
    }

    @Override
    public String fetchReadme(String packageName, String version) {
        String ref = CacheKeys.LATEST_VERSION.equals(version) ? LATEST_REF : version;
        String url = properties.getReadmeBaseUrl() + "/{name}/{ref}/README.md";
        return execute("README of " + packageName + "@" + ref, () ->
                restTemplate.getForObject(url, String.class, packageName, ref));
    }

    @Override
    public String fetchGithubReadme(String owner, String repository) {
        String url = properties.getGithubRawBaseUrl() + "/{owner}/{repo}/HEAD/README.md";
        return execute("README of github.com/" + owner + "/" + repository, () ->
                restTemplate.getForObject(url, String.class, owner, repository));
    }

    /**
     * 执行请求并统一转换异常，404 视为不存在
     */
    private <T> T execute(String target, Supplier<T> request) {
        log.debug("请求注册中心: target={}", target);
        try {
            return request.get();
        } catch (HttpClientErrorException.NotFound e) {
            log.info("注册中心未找到资源: target={}", target);
            return null;
        } catch (HttpStatusCodeException e) {
            throw new RegistryLookupException(
                    "Registry returned " + e.getRawStatusCode() + " for " + target, e,
                    target, LookupFailureReason.HTTP_ERROR);
        } catch (ResourceAccessException e) {
            LookupFailureReason reason = e.getCause() instanceof SocketTimeoutException
                    ? LookupFailureReason.TIMEOUT
                    : LookupFailureReason.NETWORK_ERROR;
            throw new RegistryLookupException(
                    "Failed to reach registry for " + target, e, target, reason);
        } catch (RestClientException e) {
            throw new RegistryLookupException(
                    "Failed to read registry response for " + target, e,
                    target, LookupFailureReason.UNKNOWN);
        }
    }
}
