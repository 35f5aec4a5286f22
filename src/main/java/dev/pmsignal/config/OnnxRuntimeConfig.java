package dev.pmsignal.config;

import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtLoggingLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.BeansException;
import org.springframework.beans.factory.config.BeanFactoryPostProcessor;
import org.springframework.beans.factory.config.ConfigurableListableBeanFactory;
import org.springframework.context.EnvironmentAware;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

/**
 * Initialises the shared ONNX Runtime environment before the in-process embedding and
 * cross-encoder beans are created.
 *
 * <p>The {@link OrtEnvironment} is a process-wide singleton that cannot be reconfigured once
 * created, and the BGE embedding model touches it from a static initializer. Running as a {@link
 * BeanFactoryPostProcessor} guarantees the threading options below are applied first.
 *
 * <p>Thread counts come from {@code pmsignal.onnx.intra-op-threads} (default 4) and {@code
 * pmsignal.onnx.inter-op-threads} (default 2). Spinning is always disabled; ingestion is bursty
 * and idle spinning workers would otherwise hold a core each.
 */
@Configuration
@SuppressWarnings("NullAway")
public class OnnxRuntimeConfig implements BeanFactoryPostProcessor, EnvironmentAware {

  private static final Logger log = LoggerFactory.getLogger(OnnxRuntimeConfig.class);

  private int intraOpThreads = 4;
  private int interOpThreads = 2;

  @Override
  public void setEnvironment(Environment environment) {
    intraOpThreads = environment.getProperty("pmsignal.onnx.intra-op-threads", Integer.class, 4);
    interOpThreads = environment.getProperty("pmsignal.onnx.inter-op-threads", Integer.class, 2);
  }

  @Override
  public void postProcessBeanFactory(ConfigurableListableBeanFactory beanFactory)
      throws BeansException {
    try (var threadingOptions = new OrtEnvironment.ThreadingOptions()) {
      threadingOptions.setGlobalSpinControl(false);
      threadingOptions.setGlobalIntraOpNumThreads(intraOpThreads);
      threadingOptions.setGlobalInterOpNumThreads(interOpThreads);

      OrtEnvironment.getEnvironment(
          OrtLoggingLevel.ORT_LOGGING_LEVEL_WARNING, "pm-signal", threadingOptions);

      log.info(
          "ONNX Runtime ready for feedback embedding: intra-op={}, inter-op={}",
          intraOpThreads,
          interOpThreads);
    } catch (OrtException e) {
      throw new IllegalStateException("Failed to configure ONNX Runtime threading", e);
    } catch (IllegalStateException e) {
      log.warn(
          "ONNX Runtime environment was created before configuration; using its existing "
              + "threading options. Detail: {}",
          e.getMessage());
    }
  }
}
