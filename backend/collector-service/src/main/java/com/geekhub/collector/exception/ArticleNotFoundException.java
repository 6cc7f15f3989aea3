package com.geekhub.collector.exception;

public class ArticleNotFoundException extends CollectorException {

    public ArticleNotFoundException(Long articleId) {
        super("ARTICLE_NOT_FOUND", "Article not found: " + articleId);
    }
}
