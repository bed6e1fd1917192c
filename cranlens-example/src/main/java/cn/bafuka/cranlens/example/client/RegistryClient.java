package cn.bafuka.cranlens.example.client;

import java.util.Map;

/**
 * R 包注册中心客户端
 * 返回上游的原始 JSON 结构，不做字段转换；资源不存在时返回 null
 */
public interface RegistryClient {

    /**
     * 获取包的最新元数据
     *
     * @param packageName 包名
     * @return crandb 返回的 JSON，不存在返回 null
     */
    Map<String, Object> fetchPackage(String packageName);

    /**
     * 获取全部包的名称、版本和标题
     *
     * @return 包名到描述信息的映射
     */
    Map<String, Object> fetchPackageIndex();

    /**
     * 获取 README 原文
     *
     * @param packageName 包名
     * @param version     版本号，latest 表示最新版本
     * @return README 内容，不存在返回 null
     */
    String fetchReadme(String packageName, String version);

    /**
     * 从包作者自己的 GitHub 仓库获取 README（默认分支）
     *
     * @param owner      仓库所有者
     * @param repository 仓库名
     * @return README 内容，不存在返回 null
     */
    String fetchGithubReadme(String owner, String repository);
}
