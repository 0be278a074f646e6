package ru.aritmos.clusterreceiver.config;

import io.micronaut.context.annotation.ConfigurationProperties;

/**
 * Typed-конфигурация Cluster Receiver Service.
 * <p>
 * Единая точка чтения адресов внешних зависимостей (identity-сервис, action engine, реестр кластеров),
 * их таймаутов, параметров листинга и публичного адреса webhook-каналов.
 */
@ConfigurationProperties("clusterreceiver")
public class ClusterReceiverProperties {

    private Channel channel = new Channel();
    private Identity identity = new Identity();
    private ActionEngine actionEngine = new ActionEngine();
    private ClusterRegistry clusterRegistry = new ClusterRegistry();
    private Listing listing = new Listing();
    private Api api = new Api();

    public Channel getChannel() {
        return channel;
    }

    public void setChannel(Channel channel) {
        this.channel = channel == null ? new Channel() : channel;
    }

    public Identity getIdentity() {
        return identity;
    }

    public void setIdentity(Identity identity) {
        this.identity = identity == null ? new Identity() : identity;
    }

    public ActionEngine getActionEngine() {
        return actionEngine;
    }

    public void setActionEngine(ActionEngine actionEngine) {
        this.actionEngine = actionEngine == null ? new ActionEngine() : actionEngine;
    }

    public ClusterRegistry getClusterRegistry() {
        return clusterRegistry;
    }

    public void setClusterRegistry(ClusterRegistry clusterRegistry) {
        this.clusterRegistry = clusterRegistry == null ? new ClusterRegistry() : clusterRegistry;
    }

    public Listing getListing() {
        return listing;
    }

    public void setListing(Listing listing) {
        this.listing = listing == null ? new Listing() : listing;
    }

    public Api getApi() {
        return api;
    }

    public void setApi(Api api) {
        this.api = api == null ? new Api() : api;
    }

    /**
     * Публичный адрес, из которого строятся URL webhook-каналов.
     */
    @ConfigurationProperties("channel")
    public static class Channel {
        private String publicBaseUrl = "http://localhost:8778";

        public String getPublicBaseUrl() {
            return publicBaseUrl;
        }

        public void setPublicBaseUrl(String publicBaseUrl) {
            this.publicBaseUrl = trimTrailingSlash(publicBaseUrl, "http://localhost:8778");
        }
    }

    /**
     * Базовая конфигурация HTTP-зависимости.
     */
    public static class Endpoint {
        private String baseUrl;
        private long timeoutMs = 5000;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = trimTrailingSlash(baseUrl, null);
        }

        public long getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(long timeoutMs) {
            this.timeoutMs = Math.max(200, timeoutMs);
        }
    }

    /**
     * Identity-сервис (Keystone v3 совместимый API): trust'ы и токены.
     * <p>
     * Сервисная учётная запись является trustee для всех делегированных trust'ов.
     */
    @ConfigurationProperties("identity")
    public static class Identity extends Endpoint {
        private String serviceUser = "clusterreceiver";
        private String servicePassword;
        private String serviceDomain = "Default";
        private String serviceProject = "service";
        private int tokenCacheMaxEntries = 1000;
        private long tokenCacheTtlSeconds = 300;

        public String getServiceUser() {
            return serviceUser;
        }

        public void setServiceUser(String serviceUser) {
            this.serviceUser = serviceUser;
        }

        public String getServicePassword() {
            return servicePassword;
        }

        public void setServicePassword(String servicePassword) {
            this.servicePassword = servicePassword;
        }

        public String getServiceDomain() {
            return serviceDomain;
        }

        public void setServiceDomain(String serviceDomain) {
            this.serviceDomain = serviceDomain;
        }

        public String getServiceProject() {
            return serviceProject;
        }

        public void setServiceProject(String serviceProject) {
            this.serviceProject = serviceProject;
        }

        public int getTokenCacheMaxEntries() {
            return tokenCacheMaxEntries;
        }

        public void setTokenCacheMaxEntries(int tokenCacheMaxEntries) {
            this.tokenCacheMaxEntries = Math.max(1, tokenCacheMaxEntries);
        }

        public long getTokenCacheTtlSeconds() {
            return tokenCacheTtlSeconds;
        }

        public void setTokenCacheTtlSeconds(long tokenCacheTtlSeconds) {
            this.tokenCacheTtlSeconds = Math.max(0, tokenCacheTtlSeconds);
        }
    }

    @ConfigurationProperties("action-engine")
    public static class ActionEngine extends Endpoint {
    }

    @ConfigurationProperties("cluster-registry")
    public static class ClusterRegistry extends Endpoint {
    }

    /**
     * Ограничения листинга.
     */
    @ConfigurationProperties("listing")
    public static class Listing {
        private int defaultLimit = 100;
        private int maxLimit = 1000;

        public int getDefaultLimit() {
            return defaultLimit;
        }

        public void setDefaultLimit(int defaultLimit) {
            this.defaultLimit = Math.max(1, defaultLimit);
        }

        public int getMaxLimit() {
            return maxLimit;
        }

        public void setMaxLimit(int maxLimit) {
            this.maxLimit = Math.max(1, maxLimit);
        }
    }

    /**
     * Диапазон поддерживаемых микроверсий API ({@code OpenStack-API-Version: clustering X.Y}).
     */
    @ConfigurationProperties("api")
    public static class Api {
        private String minVersion = "1.0";
        private String maxVersion = "1.10";

        public String getMinVersion() {
            return minVersion;
        }

        public void setMinVersion(String minVersion) {
            this.minVersion = minVersion == null || minVersion.isBlank() ? "1.0" : minVersion.trim();
        }

        public String getMaxVersion() {
            return maxVersion;
        }

        public void setMaxVersion(String maxVersion) {
            this.maxVersion = maxVersion == null || maxVersion.isBlank() ? "1.10" : maxVersion.trim();
        }
    }

    private static String trimTrailingSlash(String value, String fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        String t = value.trim();
        while (t.endsWith("/")) {
            t = t.substring(0, t.length() - 1);
        }
        return t;
    }
}
