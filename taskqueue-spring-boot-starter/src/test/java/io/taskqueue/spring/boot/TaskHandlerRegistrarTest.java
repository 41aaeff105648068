package io.taskqueue.spring.boot;

import io.taskqueue.DispatchResult;
import io.taskqueue.TaskHandler;
import io.taskqueue.registry.DefaultHandlerRegistry;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import static org.junit.jupiter.api.Assertions.*;

class TaskHandlerRegistrarTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withUserConfiguration(RegistrarConfig.class);

  @Test
  void registersHandlersByQueue() {
    runner.withUserConfiguration(TwoHandlersConfig.class).run(ctx -> {
      var registry = ctx.getBean(DefaultHandlerRegistry.class);
      assertNotNull(registry.handlerFor("wearable-sync"));
      assertNotNull(registry.handlerFor("notifications-dispatch"));
      assertNull(registry.handlerFor("insights-generate"));
    });
  }

  @Test
  void failsWhenBeanDoesNotImplementTaskHandler() {
    runner.withUserConfiguration(NotAHandlerConfig.class).run(ctx -> {
      assertNotNull(ctx.getStartupFailure());
      assertInstanceOf(BeanCreationException.class, ctx.getStartupFailure());
    });
  }

  @Test
  void failsWhenTwoHandlersClaimOneQueue() {
    runner.withUserConfiguration(DuplicateQueueConfig.class).run(ctx -> {
      assertNotNull(ctx.getStartupFailure());
      assertInstanceOf(BeanCreationException.class, ctx.getStartupFailure());
      assertTrue(ctx.getStartupFailure().getMessage().contains("wearable-sync"));
    });
  }

  @Test
  void failsWhenQueueIsBlank() {
    runner.withUserConfiguration(BlankQueueConfig.class).run(ctx -> {
      assertNotNull(ctx.getStartupFailure());
      assertInstanceOf(BeanCreationException.class, ctx.getStartupFailure());
    });
  }

  // ── Test support ─────────────────────────────────────────────

  @Configuration
  static class RegistrarConfig {
    @Bean
    DefaultHandlerRegistry handlerRegistry() {
      return new DefaultHandlerRegistry();
    }

    @Bean
    TaskHandlerRegistrar taskHandlerRegistrar(ListableBeanFactory beanFactory, DefaultHandlerRegistry registry) {
      return new TaskHandlerRegistrar(beanFactory, registry);
    }
  }

  @TaskQueueHandler("wearable-sync")
  static class SyncHandler implements TaskHandler {
    @Override
    public DispatchResult handle(String taskName) {
      return DispatchResult.succeeded();
    }
  }

  @TaskQueueHandler("notifications-dispatch")
  static class NotificationHandler implements TaskHandler {
    @Override
    public DispatchResult handle(String taskName) {
      return DispatchResult.handled();
    }
  }

  @TaskQueueHandler("wearable-sync")
  static class SecondSyncHandler implements TaskHandler {
    @Override
    public DispatchResult handle(String taskName) {
      return DispatchResult.succeeded();
    }
  }

  @TaskQueueHandler(" ")
  static class BlankQueueHandler implements TaskHandler {
    @Override
    public DispatchResult handle(String taskName) {
      return DispatchResult.succeeded();
    }
  }

  @TaskQueueHandler("wearable-sync")
  static class NotAHandler {
  }

  @Configuration
  static class TwoHandlersConfig {
    @Bean
    SyncHandler syncHandler() {
      return new SyncHandler();
    }

    @Bean
    NotificationHandler notificationHandler() {
      return new NotificationHandler();
    }
  }

  @Configuration
  static class NotAHandlerConfig {
    @Bean
    NotAHandler notAHandler() {
      return new NotAHandler();
    }
  }

  @Configuration
  static class DuplicateQueueConfig {
    @Bean
    SyncHandler syncHandler() {
      return new SyncHandler();
    }

    @Bean
    SecondSyncHandler secondSyncHandler() {
      return new SecondSyncHandler();
    }
  }

  @Configuration
  static class BlankQueueConfig {
    @Bean
    BlankQueueHandler blankQueueHandler() {
      return new BlankQueueHandler();
    }
  }
}
