package com.example.fanout.model;

/** 一覧取得 1 回分のページングとフィルタ条件。 */
public record ListOptions(int limit, int skip, boolean onlyUnread) {}
