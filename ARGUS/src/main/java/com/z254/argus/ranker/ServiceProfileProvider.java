package com.z254.argus.ranker;

import com.z254.argus.config.ArgusProperties;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Per-service attributes used as ranker features.
 * <p>
 * Values come from {@code argus.ranker.service-profiles}; services without a
 * profile get the configured defaults, with criticality derived from the
 * critical-services list.
 */
@Component
public class ServiceProfileProvider {

    private final ArgusProperties.Ranker config;

    public ServiceProfileProvider(ArgusProperties properties) {
        this.config = properties.getRanker();
    }

    public double criticality(String service) {
        ArgusProperties.Ranker.ServiceProfile profile = profile(service);
        if (profile != null && profile.getCriticality() != null) {
            return profile.getCriticality();
        }
        if (service != null && config.getCriticalServices().contains(service.toLowerCase(Locale.ROOT))) {
            return config.getCriticalServiceWeight();
        }
        return config.getDefaultServiceWeight();
    }

    public double alertRate(String service) {
        ArgusProperties.Ranker.ServiceProfile profile = profile(service);
        return profile != null && profile.getAlertRate() != null
                ? profile.getAlertRate()
                : config.getDefaultAlertRate();
    }

    public double falsePositiveRate(String service) {
        ArgusProperties.Ranker.ServiceProfile profile = profile(service);
        return profile != null && profile.getFalsePositiveRate() != null
                ? profile.getFalsePositiveRate()
                : config.getDefaultFalsePositiveRate();
    }

    private ArgusProperties.Ranker.ServiceProfile profile(String service) {
        return service == null ? null : config.getServiceProfiles().get(service);
    }
}
