/**
 * 幂等键管理、内容哈希与内容去重
 */
package xyz.firestige.redis.guard.idempotency;
