package aquabase.app;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Primary;
import org.springframework.validation.annotation.Validated;

import aquabase.app.control.CorrelationTimeouts;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

@ConfigurationProperties(prefix = "app")
@Primary
@Validated
public class AppProperties {
    @NotBlank
    private String projectName;
    private String mqttServerAddress;
    @Min(1)
    @Max(65535)
    private int mqttServerPort = 1883;
    @Min(1)
    private int mqttConnectTimeoutSeconds = 5;
    private String rabbitmqServerAddress;
    @NotBlank
    private String notificationExchangeName;
    @Min(30000)
    @Max(90000)
    private int notificationExpiryMs = 60000;
    @Min(50)
    private int correlationPollIntervalMs = 500;
    @Min(1)
    private int responseFreshnessSeconds = 10;
    @Min(1)
    private int slaveResponseDeadlineSeconds = 5;
    @Min(1)
    private int aliveReplyDeadlineSeconds = 5;
    @Min(1)
    private int tankUpdateDeadlineSeconds = 10;
    @Min(60)
    private int responseRetentionSeconds = 600;
    @Min(1)
    private int offlineTimeoutSeconds = 300;
    @Min(1)
    private int livenessSweepSeconds = 60;

    public String getProjectName() {
        return projectName;
    }
    public void setProjectName(String projectName) {
        this.projectName = projectName;
    }
    public String getMqttServerAddress() {
        return mqttServerAddress;
    }
    public void setMqttServerAddress(String mqttServerAddress) {
        this.mqttServerAddress = mqttServerAddress;
    }
    public int getMqttServerPort() {
        return mqttServerPort;
    }
    public void setMqttServerPort(int mqttServerPort) {
        this.mqttServerPort = mqttServerPort;
    }
    public int getMqttConnectTimeoutSeconds() {
        return mqttConnectTimeoutSeconds;
    }
    public void setMqttConnectTimeoutSeconds(int mqttConnectTimeoutSeconds) {
        this.mqttConnectTimeoutSeconds = mqttConnectTimeoutSeconds;
    }
    public String getRabbitmqServerAddress() {
        return rabbitmqServerAddress;
    }
    public void setRabbitmqServerAddress(String rabbitmqServerAddress) {
        this.rabbitmqServerAddress = rabbitmqServerAddress;
    }
    public String getNotificationExchangeName() {
        return notificationExchangeName;
    }
    public void setNotificationExchangeName(String notificationExchangeName) {
        this.notificationExchangeName = notificationExchangeName;
    }
    public int getNotificationExpiryMs() {
        return notificationExpiryMs;
    }
    public void setNotificationExpiryMs(int notificationExpiryMs) {
        this.notificationExpiryMs = notificationExpiryMs;
    }
    public int getCorrelationPollIntervalMs() {
        return correlationPollIntervalMs;
    }
    public void setCorrelationPollIntervalMs(int correlationPollIntervalMs) {
        this.correlationPollIntervalMs = correlationPollIntervalMs;
    }
    public int getResponseFreshnessSeconds() {
        return responseFreshnessSeconds;
    }
    public void setResponseFreshnessSeconds(int responseFreshnessSeconds) {
        this.responseFreshnessSeconds = responseFreshnessSeconds;
    }
    public int getSlaveResponseDeadlineSeconds() {
        return slaveResponseDeadlineSeconds;
    }
    public void setSlaveResponseDeadlineSeconds(int slaveResponseDeadlineSeconds) {
        this.slaveResponseDeadlineSeconds = slaveResponseDeadlineSeconds;
    }
    public int getAliveReplyDeadlineSeconds() {
        return aliveReplyDeadlineSeconds;
    }
    public void setAliveReplyDeadlineSeconds(int aliveReplyDeadlineSeconds) {
        this.aliveReplyDeadlineSeconds = aliveReplyDeadlineSeconds;
    }
    public int getTankUpdateDeadlineSeconds() {
        return tankUpdateDeadlineSeconds;
    }
    public void setTankUpdateDeadlineSeconds(int tankUpdateDeadlineSeconds) {
        this.tankUpdateDeadlineSeconds = tankUpdateDeadlineSeconds;
    }
    public int getResponseRetentionSeconds() {
        return responseRetentionSeconds;
    }
    public void setResponseRetentionSeconds(int responseRetentionSeconds) {
        this.responseRetentionSeconds = responseRetentionSeconds;
    }
    public int getOfflineTimeoutSeconds() {
        return offlineTimeoutSeconds;
    }
    public void setOfflineTimeoutSeconds(int offlineTimeoutSeconds) {
        this.offlineTimeoutSeconds = offlineTimeoutSeconds;
    }
    public int getLivenessSweepSeconds() {
        return livenessSweepSeconds;
    }
    public void setLivenessSweepSeconds(int livenessSweepSeconds) {
        this.livenessSweepSeconds = livenessSweepSeconds;
    }
    public CorrelationTimeouts correlationTimeouts() {
        return new CorrelationTimeouts(
            Duration.ofSeconds(responseFreshnessSeconds),
            Duration.ofSeconds(slaveResponseDeadlineSeconds),
            Duration.ofSeconds(aliveReplyDeadlineSeconds),
            Duration.ofSeconds(tankUpdateDeadlineSeconds));
    }
}
