package com.example.admission;

import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * ゲートの後ろに置くサンプルのハンドラ。
 *
 *  curl -i -H "X-API-KEY: demo-key-1" http://localhost:8083/hello
 */
@RestController
public class GreetingController {

    @RequestMapping("/hello")
    public String hello() {
        return "Hello World";
    }

    @RequestMapping("/world")
    public String world() {
        return "Welcome to the World";
    }
}
