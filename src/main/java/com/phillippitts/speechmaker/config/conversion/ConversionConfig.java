package com.phillippitts.speechmaker.config.conversion;

import com.phillippitts.speechmaker.config.properties.ConversionProperties;
import com.phillippitts.speechmaker.config.properties.ConverterProperties;
import com.phillippitts.speechmaker.config.properties.DiagnosticsProperties;
import com.phillippitts.speechmaker.config.properties.ReadinessProperties;
import com.phillippitts.speechmaker.config.properties.RetryProperties;
import com.phillippitts.speechmaker.config.properties.VoiceEngineProperties;
import com.phillippitts.speechmaker.service.conversion.ChunkFileCleaner;
import com.phillippitts.speechmaker.service.conversion.ConversionOrchestrator;
import com.phillippitts.speechmaker.service.conversion.ConversionService;
import com.phillippitts.speechmaker.service.conversion.DefaultConversionOrchestrator;
import com.phillippitts.speechmaker.service.converter.AudioConverter;
import com.phillippitts.speechmaker.service.converter.AudioConverterProbe;
import com.phillippitts.speechmaker.service.converter.WavConcatenator;
import com.phillippitts.speechmaker.service.engine.VoiceEngine;
import com.phillippitts.speechmaker.service.error.ErrorClassifier;
import com.phillippitts.speechmaker.service.error.ErrorLog;
import com.phillippitts.speechmaker.service.input.TextFileReader;
import com.phillippitts.speechmaker.service.metrics.ConversionMetrics;
import com.phillippitts.speechmaker.service.output.OutputFileNamer;
import com.phillippitts.speechmaker.service.output.OutputFolders;
import com.phillippitts.speechmaker.service.readiness.ReadinessInitializer;
import com.phillippitts.speechmaker.service.readiness.ReadinessStateMachine;
import com.phillippitts.speechmaker.service.resource.ResourceResolver;
import com.phillippitts.speechmaker.service.retry.RetryPolicy;
import com.phillippitts.speechmaker.service.retry.Sleeper;
import com.phillippitts.speechmaker.service.text.TextChunker;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.Executor;

/**
 * Wires the conversion engine explicitly: two retry policies share one type, and the resolver,
 * orchestrator and facade each need a specific executor.
 */
@Configuration
public class ConversionConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ErrorLog errorLog(DiagnosticsProperties properties) {
        return new ErrorLog(properties.getErrorLogCapacity());
    }

    @Bean
    public ErrorClassifier errorClassifier(ErrorLog errorLog, ApplicationEventPublisher publisher, Clock clock) {
        return new ErrorClassifier(errorLog, publisher, clock);
    }

    /**
     * Per-chunk synthesis retries ({@code retry.max-chunk-attempts}).
     */
    @Bean(name = "chunkRetryPolicy")
    public RetryPolicy chunkRetryPolicy(RetryProperties properties) {
        return new RetryPolicy(properties.getBaseDelayMs(), properties.getCapDelayMs(),
                properties.getMaxChunkAttempts(), Sleeper.SYSTEM);
    }

    /**
     * Voice listing retries ({@code retry.voice-list-max-attempts}).
     */
    @Bean(name = "voiceRetryPolicy")
    public RetryPolicy voiceRetryPolicy(RetryProperties properties) {
        return new RetryPolicy(properties.getBaseDelayMs(), properties.getCapDelayMs(),
                properties.getVoiceListMaxAttempts(), Sleeper.SYSTEM);
    }

    @Bean
    public ResourceResolver resourceResolver(AudioConverterProbe converterProbe,
                                             VoiceEngine voiceEngine,
                                             ErrorClassifier classifier,
                                             @Qualifier("voiceRetryPolicy") RetryPolicy voiceRetryPolicy,
                                             @Qualifier("resourceExecutor") Executor resourceExecutor,
                                             ConverterProperties converterProperties,
                                             VoiceEngineProperties engineProperties,
                                             Clock clock) {
        return new ResourceResolver(converterProbe, voiceEngine, classifier, voiceRetryPolicy, resourceExecutor,
                converterProperties, engineProperties, clock);
    }

    @Bean
    public ReadinessStateMachine readinessStateMachine() {
        return new ReadinessStateMachine();
    }

    @Bean
    public ReadinessInitializer readinessInitializer(ResourceResolver resolver,
                                                     ReadinessStateMachine stateMachine,
                                                     OutputFolders outputFolders,
                                                     ReadinessProperties properties) {
        return new ReadinessInitializer(resolver, stateMachine, outputFolders, properties);
    }

    @Bean
    public ChunkFileCleaner chunkFileCleaner(ErrorClassifier classifier) {
        return new ChunkFileCleaner(classifier);
    }

    @Bean
    public ConversionOrchestrator conversionOrchestrator(VoiceEngine voiceEngine,
                                                         AudioConverter audioConverter,
                                                         WavConcatenator wavConcatenator,
                                                         ErrorClassifier classifier,
                                                         @Qualifier("chunkRetryPolicy") RetryPolicy chunkRetryPolicy,
                                                         @Qualifier("conversionExecutor") Executor conversionExecutor,
                                                         ChunkFileCleaner cleaner,
                                                         ApplicationEventPublisher publisher,
                                                         ConversionMetrics metrics,
                                                         ConversionProperties properties,
                                                         Clock clock) {
        return new DefaultConversionOrchestrator(voiceEngine, audioConverter, wavConcatenator, classifier,
                chunkRetryPolicy, conversionExecutor, cleaner, publisher, metrics,
                properties.getMaxConcurrentChunks(), clock);
    }

    @Bean
    public ConversionService conversionService(ReadinessStateMachine readiness,
                                               ResourceResolver resolver,
                                               TextChunker chunker,
                                               TextFileReader fileReader,
                                               OutputFileNamer fileNamer,
                                               OutputFolders folders,
                                               ConversionOrchestrator orchestrator,
                                               ChunkFileCleaner cleaner,
                                               ErrorClassifier classifier,
                                               @Qualifier("sessionExecutor") Executor sessionExecutor,
                                               ConversionProperties properties,
                                               Clock clock) {
        return new ConversionService(readiness, resolver, chunker, fileReader, fileNamer, folders, orchestrator,
                cleaner, classifier, sessionExecutor, properties, clock);
    }
}
