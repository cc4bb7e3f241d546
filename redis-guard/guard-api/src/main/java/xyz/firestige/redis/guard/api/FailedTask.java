package xyz.firestige.redis.guard.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 失败任务
 *
 * <p>首次上报失败时创建。retryCount 小于最大重试次数时位于重试计划（ZSet，score = 重试时间），
 * 否则进入死信归档（List）。以 JSON 形式存储，字段名为 snake_case：
 * <pre>{@code
 * {"id":"crawl:5f3c...","task_name":"crawl","args":{"url":"..."},"error":"timeout",
 *  "retry_count":1,"failed_at":"2024-05-01T10:00:00Z","metadata":{},"status":"pending_retry"}
 * }</pre>
 *
 * @since 1.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class FailedTask {

    @JsonProperty("id")
    private String id;

    @JsonProperty("task_name")
    private String taskName;

    @JsonProperty("args")
    private Map<String, Object> args = new LinkedHashMap<>();

    @JsonProperty("error")
    private String error;

    @JsonProperty("retry_count")
    private int retryCount;

    @JsonProperty("failed_at")
    private Instant failedAt;

    @JsonProperty("metadata")
    private Map<String, Object> metadata = new LinkedHashMap<>();

    @JsonProperty("status")
    private FailedTaskStatus status;

    @JsonProperty("manually_retried_at")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private Instant manuallyRetriedAt;

    public FailedTask() {
    }

    public FailedTask(String id, String taskName, Map<String, Object> args, String error,
                      int retryCount, Instant failedAt, Map<String, Object> metadata,
                      FailedTaskStatus status) {
        this.id = id;
        this.taskName = taskName;
        setArgs(args);
        this.error = error;
        this.retryCount = retryCount;
        this.failedAt = failedAt;
        setMetadata(metadata);
        this.status = status;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getTaskName() {
        return taskName;
    }

    public void setTaskName(String taskName) {
        this.taskName = taskName;
    }

    public Map<String, Object> getArgs() {
        return args;
    }

    public void setArgs(Map<String, Object> args) {
        this.args = args != null ? new LinkedHashMap<>(args) : new LinkedHashMap<>();
    }

    public String getError() {
        return error;
    }

    public void setError(String error) {
        this.error = error;
    }

    public int getRetryCount() {
        return retryCount;
    }

    public void setRetryCount(int retryCount) {
        this.retryCount = retryCount;
    }

    public Instant getFailedAt() {
        return failedAt;
    }

    public void setFailedAt(Instant failedAt) {
        this.failedAt = failedAt;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public void setMetadata(Map<String, Object> metadata) {
        this.metadata = metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>();
    }

    public FailedTaskStatus getStatus() {
        return status;
    }

    public void setStatus(FailedTaskStatus status) {
        this.status = status;
    }

    public Instant getManuallyRetriedAt() {
        return manuallyRetriedAt;
    }

    public void setManuallyRetriedAt(Instant manuallyRetriedAt) {
        this.manuallyRetriedAt = manuallyRetriedAt;
    }

    @Override
    public String toString() {
        return "FailedTask{id='" + id + "', taskName='" + taskName + "', retryCount=" + retryCount
                + ", status=" + status + ", failedAt=" + failedAt + '}';
    }
}
