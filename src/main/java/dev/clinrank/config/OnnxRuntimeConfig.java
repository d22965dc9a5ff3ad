package dev.clinrank.config;

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
 * Sets up the ONNX Runtime environment before the embedding model and any cross-encoder bean are
 * created.
 *
 * <p>{@link OrtEnvironment} is a process-wide singleton that cannot be reconfigured once
 * created, so this runs as a {@link BeanFactoryPostProcessor}. Thread counts come from {@code
 * clinrank.onnx.intra-op-threads} (default 4) and {@code clinrank.onnx.inter-op-threads}
 * (default 2); spinning is disabled.
 */
@Configuration
public class OnnxRuntimeConfig implements BeanFactoryPostProcessor, EnvironmentAware {

  private static final Logger log = LoggerFactory.getLogger(OnnxRuntimeConfig.class);

  private int intraOpThreads = 4;
  private int interOpThreads = 2;

  @Override
  public void setEnvironment(Environment environment) {
    intraOpThreads = environment.getProperty("clinrank.onnx.intra-op-threads", Integer.class, 4);
    interOpThreads = environment.getProperty("clinrank.onnx.inter-op-threads", Integer.class, 2);
  }

  @Override
  public void postProcessBeanFactory(ConfigurableListableBeanFactory beanFactory)
      throws BeansException {
    try (var threadingOptions = new OrtEnvironment.ThreadingOptions()) {
      threadingOptions.setGlobalSpinControl(false);
      threadingOptions.setGlobalIntraOpNumThreads(intraOpThreads);
      threadingOptions.setGlobalInterOpNumThreads(interOpThreads);

      OrtEnvironment.getEnvironment(
          OrtLoggingLevel.ORT_LOGGING_LEVEL_WARNING, "clinrank", threadingOptions);

      log.info(
          "ONNX Runtime initialized: spinning=off, intra-op={}, inter-op={}",
          intraOpThreads,
          interOpThreads);
    } catch (OrtException e) {
      throw new IllegalStateException("Failed to configure ONNX Runtime threading", e);
    } catch (IllegalStateException e) {
      log.warn(
          "ONNX Runtime environment already initialized, threading options not applied: {}",
          e.getMessage());
    }
  }
}
