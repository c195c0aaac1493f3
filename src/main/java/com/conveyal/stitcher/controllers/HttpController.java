package com.conveyal.stitcher.controllers;

/**
 * All of our classes defining HTTP API endpoints implement this interface.
 * It has a single method that registers all the endpoints.
 * Each controller implementation should have a constructor taking all the application Components it needs as arguments.
 */
public interface HttpController {

    void registerEndpoints (spark.Service sparkService);

}
