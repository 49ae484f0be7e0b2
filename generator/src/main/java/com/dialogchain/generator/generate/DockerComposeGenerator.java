package com.dialogchain.generator.generate;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes {@code docker-compose.yml}. The template's {@code app} service
 * becomes the project's own container, named after the project; every other
 * service name is looked up in a small catalogue of images.
 */
public class DockerComposeGenerator {
    static final String APP_SERVICE = "app";

    private static final Map<String, Map<String, Object>> CATALOGUE = Map.of(
            "redis", service("redis", "redis:7-alpine", List.of("6379:6379"), List.of()),
            "mqtt", service("mqtt", "eclipse-mosquitto:2", List.of("1883:1883"), List.of()),
            "postgres", service("postgres", "postgres:16-alpine", List.of("5432:5432"), List.of(
                    "POSTGRES_USER=iot",
                    "POSTGRES_PASSWORD=password",
                    "POSTGRES_DB=iot"))
    );

    private final HandlebarsEngine engine;

    public DockerComposeGenerator(HandlebarsEngine engine) {
        this.engine = engine;
    }

    public void generate(GenerationContext context) throws IOException {
        List<String> declared = context.template().dockerServices();
        List<Map<String, Object>> services = new ArrayList<>();
        List<String> others = new ArrayList<>();
        for (String name : declared) {
            if (!APP_SERVICE.equals(name)) {
                others.add(name);
                services.add(CATALOGUE.getOrDefault(name, service(name, name + ":latest", List.of(), List.of())));
            }
        }

        List<String> appEnvironment = new ArrayList<>();
        appEnvironment.add("ENVIRONMENT=development");
        context.template().environmentVars().forEach((name, value) -> {
            if (!"ENVIRONMENT".equals(name)) {
                appEnvironment.add(name + "=" + value);
            }
        });

        Map<String, Object> model = context.templateContext();
        model.put("includeApp", declared.contains(APP_SERVICE));
        model.put("appEnvironment", appEnvironment);
        model.put("dependsOn", others);
        model.put("services", services);

        context.write("docker-compose.yml", engine.render("docker-compose.yml", model));
    }

    private static Map<String, Object> service(String name, String image, List<String> ports, List<String> environment) {
        Map<String, Object> service = new HashMap<>();
        service.put("name", name);
        service.put("image", image);
        service.put("ports", ports);
        service.put("environment", environment);
        return service;
    }
}
