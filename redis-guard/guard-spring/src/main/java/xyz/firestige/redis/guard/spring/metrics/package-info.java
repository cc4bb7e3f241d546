/**
 * Micrometer 指标
 */
package xyz.firestige.redis.guard.spring.metrics;
