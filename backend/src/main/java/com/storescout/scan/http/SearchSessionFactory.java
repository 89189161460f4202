package com.storescout.scan.http;

@FunctionalInterface
public interface SearchSessionFactory {

    SearchSession open();
}
