/**
 * 基于队列深度的背压控制与自适应限速
 */
package xyz.firestige.redis.guard.backpressure;
