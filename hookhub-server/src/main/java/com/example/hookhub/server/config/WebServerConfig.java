package com.example.hookhub.server.config;

import org.springframework.boot.web.embedded.tomcat.TomcatServletWebServerFactory;
import org.springframework.boot.web.server.WebServerFactoryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 内嵌 Tomcat 配置
 */
@Configuration
public class WebServerConfig {

    /**
     * Tomcat 默认直接以 405 拒绝 TRACE，Webhook 入口需要转发任意方法。
     *
     * @return 连接器定制器
     */
    @Bean
    public WebServerFactoryCustomizer<TomcatServletWebServerFactory> allowTraceCustomizer() {
        return factory -> factory.addConnectorCustomizers(connector -> connector.setAllowTrace(true));
    }
}
