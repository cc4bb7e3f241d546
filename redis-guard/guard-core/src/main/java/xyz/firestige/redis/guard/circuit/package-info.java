/**
 * 进程内熔断器：状态机实现、注册表与调用包装
 */
package xyz.firestige.redis.guard.circuit;
