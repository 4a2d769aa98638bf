package com.example.dispatcher;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

@SpringBootApplication(scanBasePackages = "com.example")
public class DispatcherApplication {

    public static void main(String[] args) {
        ConfigurableApplicationContext ctx = SpringApplication.run(DispatcherApplication.class, args);
        boolean polling = ctx.getEnvironment().getProperty("dispatcher.poll.enabled", Boolean.class, false);
        if (!polling) {
            // 一次性运行：pass 完成后按 DispatchCommand 的结果退出
            System.exit(SpringApplication.exit(ctx));
        }
    }
}
