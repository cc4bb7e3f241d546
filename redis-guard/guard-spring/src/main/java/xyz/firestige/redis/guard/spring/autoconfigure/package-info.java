/**
 * Spring Boot 自动配置
 * <p>
 * 核心组件：
 * <ul>
 *   <li>{@link xyz.firestige.redis.guard.spring.autoconfigure.RedisGuardAutoConfiguration} - 自动配置类</li>
 *   <li>{@link xyz.firestige.redis.guard.spring.autoconfigure.RedisGuardProperties} - 配置属性</li>
 *   <li>{@link xyz.firestige.redis.guard.spring.autoconfigure.RedisGuardHealthIndicator} - 健康检查指示器</li>
 * </ul>
 * <p>
 * 使用方式：
 * <pre>
 * # application.yml
 * redis:
 *   guard:
 *     key-prefix: myapp
 *     circuit-breaker:
 *       instances:
 *         llm_api:
 *           failure-threshold: 3
 *           recovery-timeout: 60s
 *     dlq:
 *       retry-delays: 10s,1m,5m
 *     backpressure:
 *       thresholds:
 *         ai_processor_queue: 50
 * </pre>
 *
 * @since 1.0
 */
package xyz.firestige.redis.guard.spring.autoconfigure;
