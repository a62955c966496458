package home.heating.configuration;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ControllerConfiguration {
    /* время возврата пружины трехходового клапана, мс */
    @Value("${controller.valveReturn:8000}")
    private Long valveReturn;

    /* период пересчета правил, мс */
    @Value("${controller.ruleInterval:5000}")
    private Long ruleInterval;

    @Value("${controller.autoStart:true}")
    private Boolean autoStart;

    public Long getValveReturn() {
        return valveReturn;
    }

    public Long getRuleInterval() {
        return ruleInterval;
    }

    public Boolean getAutoStart() {
        return autoStart;
    }
}
