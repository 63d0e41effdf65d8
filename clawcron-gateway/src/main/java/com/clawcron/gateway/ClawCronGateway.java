package com.clawcron.gateway;

import com.clawcron.gateway.websocket.GatewayMethodRouter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;

import java.util.concurrent.CountDownLatch;

/**
 * ClawCron gateway entry point. Runs the scheduler until the JVM is stopped.
 */
@Slf4j
public class ClawCronGateway {

    public static void main(String[] args) throws InterruptedException {
        AnnotationConfigApplicationContext context = new AnnotationConfigApplicationContext(GatewayBeanConfig.class);
        context.registerShutdownHook();
        log.info("ClawCron gateway up, methods: {}",
                context.getBean(GatewayMethodRouter.class).getRegisteredMethods());
        new CountDownLatch(1).await();
    }
}
