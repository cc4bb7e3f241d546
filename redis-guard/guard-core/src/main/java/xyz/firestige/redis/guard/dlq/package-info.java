/**
 * 死信队列：退避重试调度、死信归档与后台重试处理器
 */
package xyz.firestige.redis.guard.dlq;
