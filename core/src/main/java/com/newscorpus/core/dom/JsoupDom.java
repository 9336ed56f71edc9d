package com.newscorpus.core.dom;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.jsoup.select.Selector;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/** jsoup 기반 {@link DomNode} 구현 */
public final class JsoupDom implements DomNode {

    private final Element el;

    private JsoupDom(Element el) {
        this.el = Objects.requireNonNull(el, "element");
    }

    /** HTML 문자열을 파싱. baseUri 는 abs:href 해석용(없으면 빈 문자열) */
    public static DomNode parse(String html, String baseUri) {
        Document doc = Jsoup.parse(html == null ? "" : html, baseUri == null ? "" : baseUri);
        return new JsoupDom(doc);
    }

    @Override
    public Optional<DomNode> selectFirst(String cssQuery) {
        try {
            Element found = el.selectFirst(cssQuery);
            return Optional.ofNullable(found).map(JsoupDom::new);
        } catch (Selector.SelectorParseException e) {
            throw new IllegalArgumentException("Bad selector: " + cssQuery, e);
        }
    }

    @Override
    public List<DomNode> selectAll(String cssQuery) {
        Elements found;
        try {
            found = el.select(cssQuery);
        } catch (Selector.SelectorParseException e) {
            throw new IllegalArgumentException("Bad selector: " + cssQuery, e);
        }
        List<DomNode> out = new ArrayList<>(found.size());
        for (Element e : found) out.add(new JsoupDom(e));
        return out;
    }

    @Override public String text() { return el.text(); }

    @Override public String attr(String name) { return el.attr(name); }

    @Override
    public String tagName() {
        return (el instanceof Document) ? "#document" : el.tagName();
    }

    @Override
    public int removeAll(String cssQuery) {
        int n = 0;
        for (Element e : el.select(cssQuery)) {
            if (e == el) continue; // 자기 자신은 제거하지 않음
            e.remove();
            n++;
        }
        return n;
    }

    @Override
    public DomNode copy() {
        return new JsoupDom(el.clone());
    }

    @Override
    public String toString() {
        return "JsoupDom<" + tagName() + ">";
    }
}
