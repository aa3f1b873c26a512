package br.com.topiccards.api.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.servlet.mvc.method.RequestMappingInfo;
import org.springframework.web.servlet.mvc.method.annotation.RequestMappingHandlerMapping;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Loga as rotas registradas na subida da aplicação, uma por linha.
 */
@Component
public class RouteMappingsLogger implements CommandLineRunner {

    private static final Logger logger = LoggerFactory.getLogger(RouteMappingsLogger.class);

    private final RequestMappingHandlerMapping handlerMapping;

    public RouteMappingsLogger(@Qualifier("requestMappingHandlerMapping") RequestMappingHandlerMapping handlerMapping) {
        this.handlerMapping = handlerMapping;
    }

    @Override
    public void run(String... args) {
        List<String> routes = describeRoutes();
        logger.info("Rotas registradas ({}):", routes.size());
        routes.forEach(route -> logger.info("  {}", route));
    }

    List<String> describeRoutes() {
        return handlerMapping.getHandlerMethods().entrySet().stream()
                .map(this::describe)
                .sorted()
                .collect(Collectors.toList());
    }

    private String describe(Map.Entry<RequestMappingInfo, ?> entry) {
        RequestMappingInfo info = entry.getKey();
        String methods = info.getMethodsCondition().getMethods().stream()
                .map(RequestMethod::name)
                .sorted()
                .collect(Collectors.joining(","));
        String paths = String.join(",", info.getPatternValues());
        return (methods.isEmpty() ? "*" : methods) + " " + paths + " -> " + entry.getValue();
    }
}
