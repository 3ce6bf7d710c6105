package cn.bafuka.recall.dataplane;

/**
 * 指纹生成器接口
 * 对 (query, scope) 生成确定性的短哈希，作为缓存主键
 */
public interface KeyHasher {

    /**
     * 计算指纹
     * query 在哈希前会转小写并去除首尾空白
     *
     * @param query 查询文本
     * @param scope 作用域
     * @return 定长十六进制字符串
     */
    String fingerprint(String query, String scope);
}
