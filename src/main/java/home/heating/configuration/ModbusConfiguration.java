package home.heating.configuration;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ModbusConfiguration {
    @Value("${modbus.tcpHost}")
    private String host;

    @Value("${modbus.tcpPort:502}")
    private Integer port;

    /* пауза после каждой операции, реле не любят частых запросов */
    @Value("${modbus.delay:50}")
    private Integer delay;

    public String getHost() {
        return host;
    }

    public Integer getPort() {
        return port;
    }

    public Integer getDelay() {
        return delay;
    }
}
