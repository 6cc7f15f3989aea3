package com.geekhub.collector.controller;

import com.geekhub.collector.dto.ContentTranslationStatus;
import com.geekhub.collector.dto.ExtractedContent;
import com.geekhub.collector.dto.FetchFullRequest;
import com.geekhub.collector.dto.TranslateRequest;
import com.geekhub.collector.dto.TranslationStatus;
import com.geekhub.collector.service.enrichment.TranslationService;
import com.geekhub.collector.service.extract.ArticleContentService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/articles")
@RequiredArgsConstructor
@Slf4j
public class ArticleController {

    private final ArticleContentService articleContentService;
    private final TranslationService translationService;

    /**
     * POST /api/articles/{id}/fetch-full - extract the full text of the article's page
     */
    @PostMapping("/{id}/fetch-full")
    public Mono<ResponseEntity<Map<String, Object>>> fetchFull(
            @PathVariable Long id,
            @RequestBody(required = false) FetchFullRequest request) {
        String overrideUrl = request != null ? request.url() : null;
        return Mono.fromCallable(() -> {
                    ExtractedContent extracted = articleContentService.fetchFull(id, overrideUrl);
                    Map<String, Object> body = new LinkedHashMap<>();
                    body.put("success", true);
                    body.put("content", extracted.content());
                    if (extracted.hasTitle()) {
                        body.put("title", extracted.title());
                    }
                    body.put("strategy", extracted.strategy());
                    return ResponseEntity.ok(body);
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * POST /api/articles/{id}/translate - queue a translation; answers before it runs
     */
    @PostMapping("/{id}/translate")
    public Mono<ResponseEntity<TranslationStatus>> translate(
            @PathVariable Long id,
            @RequestBody(required = false) TranslateRequest request) {
        return Mono.fromCallable(() -> {
                    TranslationStatus status = translationService.requestTranslation(
                            id, request != null ? request.getAiSettings() : null);
                    HttpStatus httpStatus = status.state() == TranslationStatus.State.TRANSLATED
                            ? HttpStatus.OK
                            : HttpStatus.ACCEPTED;
                    return ResponseEntity.status(httpStatus).body(status);
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * GET /api/articles/{id}/translation - current translation state
     */
    @GetMapping("/{id}/translation")
    public Mono<ResponseEntity<TranslationStatus>> getTranslation(@PathVariable Long id) {
        return Mono.fromCallable(() -> ResponseEntity.ok(translationService.getTranslation(id)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * POST /api/articles/{id}/translate-content - queue a full-content translation
     */
    @PostMapping("/{id}/translate-content")
    public Mono<ResponseEntity<ContentTranslationStatus>> translateContent(
            @PathVariable Long id,
            @RequestBody(required = false) TranslateRequest request) {
        return Mono.fromCallable(() -> {
                    ContentTranslationStatus status = translationService.requestContentTranslation(
                            id, request != null ? request.getAiSettings() : null);
                    HttpStatus httpStatus = status.state() == TranslationStatus.State.TRANSLATED
                            ? HttpStatus.OK
                            : HttpStatus.ACCEPTED;
                    return ResponseEntity.status(httpStatus).body(status);
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/{id}/content-translation")
    public Mono<ResponseEntity<ContentTranslationStatus>> getContentTranslation(@PathVariable Long id) {
        return Mono.fromCallable(() -> ResponseEntity.ok(translationService.getContentTranslation(id)))
                .subscribeOn(Schedulers.boundedElastic());
    }
}
